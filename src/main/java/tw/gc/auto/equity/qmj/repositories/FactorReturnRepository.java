package tw.gc.auto.equity.qmj.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import tw.gc.auto.equity.qmj.entities.FactorReturn;

import java.util.List;
import java.util.Optional;

@Repository
public interface FactorReturnRepository extends JpaRepository<FactorReturn, Long> {

    /**
     * Full series in period order, annual rows before the monthly rows of the same year
     */
    @Query("SELECT f FROM FactorReturn f ORDER BY f.periodYear ASC, f.periodMonth ASC NULLS FIRST")
    List<FactorReturn> findAllOrderByPeriod();

    Optional<FactorReturn> findByPeriodLabel(String periodLabel);
}
