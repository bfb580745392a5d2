package io.echomail.backend.campaign;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CampaignStateRepository extends JpaRepository<CampaignStateEntity, String> {
  List<CampaignStateEntity> findByStatusOrderByStartedAtAsc(CampaignStatus status);
}
