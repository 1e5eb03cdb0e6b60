package io.b2mash.orgguard.workout;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface WorkoutRepository extends JpaRepository<Workout, UUID> {

  List<Workout> findByOrganizationIdOrderByCreatedAtDesc(String organizationId);

  List<Workout> findByOrganizationIdAndAuthorSubjectIdOrderByCreatedAtDesc(
      String organizationId, String authorSubjectId);

  long countByOrganizationId(String organizationId);
}
