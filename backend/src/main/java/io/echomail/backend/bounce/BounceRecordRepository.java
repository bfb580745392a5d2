package io.echomail.backend.bounce;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BounceRecordRepository extends JpaRepository<BounceRecord, UUID> {

  List<BounceRecord> findByAddressOrderByRecordedAtAsc(String address);

  @Query("SELECT b.type, COUNT(b) FROM BounceRecord b GROUP BY b.type")
  List<Object[]> countByType();

  @Query(
      "SELECT b.type, COUNT(b) FROM BounceRecord b WHERE b.campaignId = :campaignId"
          + " GROUP BY b.type")
  List<Object[]> countByTypeForCampaign(@Param("campaignId") String campaignId);
}
