package uk.gegc.studyscheduler.shared.persistence.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

public interface StreakRecordEntityRepository extends JpaRepository<StreakRecordEntity, String> {
}
