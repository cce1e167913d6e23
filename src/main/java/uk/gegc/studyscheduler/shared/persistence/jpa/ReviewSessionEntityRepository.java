package uk.gegc.studyscheduler.shared.persistence.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface ReviewSessionEntityRepository extends JpaRepository<ReviewSessionEntity, String> {

    @Query("select s.startTime from ReviewSessionEntity s " +
            "where s.learnerId = :learnerId and s.completed = true " +
            "order by s.startTime asc")
    List<Instant> findCompletedStartTimes(@Param("learnerId") String learnerId);
}
