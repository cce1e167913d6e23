package uk.gegc.studyscheduler.shared.persistence.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CardStateEntityRepository extends JpaRepository<CardStateEntity, UUID> {

    List<CardStateEntity> findByLearnerId(String learnerId);

    Optional<CardStateEntity> findByLearnerIdAndCardId(String learnerId, String cardId);
}
