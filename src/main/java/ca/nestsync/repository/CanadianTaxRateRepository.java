package ca.nestsync.repository;

import ca.nestsync.entity.CanadianTaxRate;
import ca.nestsync.entity.CanadianTaxRate.Province;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface CanadianTaxRateRepository extends JpaRepository<CanadianTaxRate, UUID> {

    /**
     * Rates in force for a province on a date, newest first.
     */
    @Query("SELECT r FROM CanadianTaxRate r WHERE r.province = :province AND r.isActive = true "
            + "AND r.effectiveFrom <= :date AND (r.effectiveTo IS NULL OR r.effectiveTo >= :date) "
            + "ORDER BY r.effectiveFrom DESC")
    List<CanadianTaxRate> findEffective(@Param("province") Province province, @Param("date") LocalDate date);

    List<CanadianTaxRate> findByIsActiveTrueOrderByProvinceAsc();

    boolean existsByProvinceAndEffectiveFrom(Province province, LocalDate effectiveFrom);
}
