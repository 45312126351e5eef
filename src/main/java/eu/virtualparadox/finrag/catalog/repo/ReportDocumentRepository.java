package eu.virtualparadox.finrag.catalog.repo;

import eu.virtualparadox.finrag.catalog.EDocumentStatus;
import eu.virtualparadox.finrag.catalog.entity.ReportDocumentEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ReportDocumentRepository extends JpaRepository<ReportDocumentEntity, String> {

    Optional<ReportDocumentEntity> findFirstByTickerOrderByUpdatedAtDescCreatedAtDescIdDesc(String ticker);

    List<ReportDocumentEntity> findByTickerOrderByUpdatedAtDescCreatedAtDescIdDesc(String ticker);

    List<ReportDocumentEntity> findByTicker(String ticker, Pageable pageable);

    List<ReportDocumentEntity> findByStatus(EDocumentStatus status, Pageable pageable);

    long countByStatus(EDocumentStatus status);

    @Query("select d.ticker from ReportDocumentEntity d group by d.ticker having count(d) > 1")
    List<String> findDuplicateTickers();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ReportDocumentEntity d set d.status = :status, d.updatedAt = :updatedAt where d.id = :id")
    int updateStatus(@Param("id") String id,
                     @Param("status") EDocumentStatus status,
                     @Param("updatedAt") Instant updatedAt);
}
