package io.echomail.backend.lock;

import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DispatchLockRepository extends JpaRepository<DispatchLockEntry, String> {

  @Modifying
  @Query(
      value =
          """
          INSERT INTO dispatch_lock (campaign_id, owner_id, acquired_at)
          VALUES (:campaignId, :ownerId, :now)
          ON CONFLICT (campaign_id) DO NOTHING
          """,
      nativeQuery = true)
  int insertIfAbsent(
      @Param("campaignId") String campaignId,
      @Param("ownerId") String ownerId,
      @Param("now") Instant now);

  /** Claims the lock if the caller already owns it or the current lease is older than cutoff. */
  @Modifying
  @Query(
      value =
          """
          UPDATE dispatch_lock SET owner_id = :ownerId, acquired_at = :now
          WHERE campaign_id = :campaignId
            AND (owner_id = :ownerId OR acquired_at < :cutoff)
          """,
      nativeQuery = true)
  int claim(
      @Param("campaignId") String campaignId,
      @Param("ownerId") String ownerId,
      @Param("now") Instant now,
      @Param("cutoff") Instant cutoff);

  @Modifying
  @Query(
      value =
          "UPDATE dispatch_lock SET acquired_at = :now"
              + " WHERE campaign_id = :campaignId AND owner_id = :ownerId",
      nativeQuery = true)
  int touch(
      @Param("campaignId") String campaignId,
      @Param("ownerId") String ownerId,
      @Param("now") Instant now);

  @Modifying
  @Query(
      value = "DELETE FROM dispatch_lock WHERE campaign_id = :campaignId AND owner_id = :ownerId",
      nativeQuery = true)
  int deleteOwned(@Param("campaignId") String campaignId, @Param("ownerId") String ownerId);

  @Modifying
  @Query(value = "DELETE FROM dispatch_lock WHERE acquired_at < :cutoff", nativeQuery = true)
  int deleteExpired(@Param("cutoff") Instant cutoff);
}
