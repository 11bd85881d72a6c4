package com.cred.freestyle.promotions.repository;

import com.cred.freestyle.promotions.domain.model.Promotion;
import com.cred.freestyle.promotions.domain.model.PromotionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository interface for Promotion entity.
 * Every finder returns a list; an empty list means no match.
 *
 * @author Promotions Team
 */
@Repository
public interface PromotionRepository extends JpaRepository<Promotion, Long> {

    /**
     * Find promotions with exactly this name.
     *
     * @param name Promotion name
     * @return List of matching promotions
     */
    List<Promotion> findByName(String name);

    /**
     * Find promotions attached to a product.
     *
     * @param productId Product ID
     * @return List of promotions for the product
     */
    List<Promotion> findByProductId(Integer productId);

    /**
     * Find promotions of one type.
     *
     * @param promotionType Promotion type
     * @return List of promotions of that type
     */
    List<Promotion> findByPromotionType(PromotionType promotionType);

    /**
     * Find promotions running on the given date (both ends inclusive).
     *
     * @param date Reference date
     * @return List of active promotions
     */
    @Query("SELECT p FROM Promotion p WHERE p.startDate <= :date AND p.endDate >= :date")
    List<Promotion> findActiveOn(@Param("date") LocalDate date);

    /**
     * Find promotions not running on the given date: not yet started or already ended.
     *
     * @param date Reference date
     * @return List of inactive promotions
     */
    @Query("SELECT p FROM Promotion p WHERE p.startDate > :date OR p.endDate < :date")
    List<Promotion> findInactiveOn(@Param("date") LocalDate date);
}
