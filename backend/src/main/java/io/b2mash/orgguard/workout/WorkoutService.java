package io.b2mash.orgguard.workout;

import io.b2mash.orgguard.api.Role;
import io.b2mash.orgguard.context.OrganizationContext;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class WorkoutService {

  private static final Logger log = LoggerFactory.getLogger(WorkoutService.class);

  private final WorkoutRepository workoutRepository;

  public WorkoutService(WorkoutRepository workoutRepository) {
    this.workoutRepository = workoutRepository;
  }

  /** Plain members only see what they wrote; trainers and owners see the whole organization. */
  @Transactional(readOnly = true)
  public List<Workout> listWorkouts(OrganizationContext context) {
    if (context.role() == Role.USER) {
      return workoutRepository.findByOrganizationIdAndAuthorSubjectIdOrderByCreatedAtDesc(
          context.organizationId(), context.subjectId());
    }
    return workoutRepository.findByOrganizationIdOrderByCreatedAtDesc(context.organizationId());
  }

  @Transactional
  public Workout createWorkout(OrganizationContext context, String title, String content) {
    var workout =
        workoutRepository.save(
            new Workout(context.organizationId(), context.subjectId(), title.strip(), content));
    log.info(
        "Created workout {} in organization {} by {}",
        workout.getId(),
        context.organizationId(),
        context.subjectId());
    return workout;
  }

  @Transactional(readOnly = true)
  public long countWorkouts(String organizationId) {
    return workoutRepository.countByOrganizationId(organizationId);
  }
}
