package io.b2mash.orgguard.workout;

import io.b2mash.orgguard.api.Permission;
import io.b2mash.orgguard.context.OrganizationContext;
import io.b2mash.orgguard.rbac.RequiresPermission;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/gym/workouts")
public class WorkoutController {

  private final WorkoutService workoutService;

  public WorkoutController(WorkoutService workoutService) {
    this.workoutService = workoutService;
  }

  @GetMapping
  @RequiresPermission(Permission.VIEW_WORKOUTS)
  public ResponseEntity<WorkoutsResponse> listWorkouts(OrganizationContext context) {
    var workouts =
        workoutService.listWorkouts(context).stream().map(WorkoutResponse::from).toList();
    return ResponseEntity.ok(new WorkoutsResponse(workouts));
  }

  @PostMapping
  @RequiresPermission(Permission.CREATE_WORKOUTS)
  public ResponseEntity<CreateWorkoutResponse> createWorkout(
      OrganizationContext context, @Valid @RequestBody CreateWorkoutRequest request) {
    var workout = workoutService.createWorkout(context, request.title(), request.content());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(new CreateWorkoutResponse(WorkoutResponse.from(workout), "Workout created"));
  }

  public record CreateWorkoutRequest(
      @NotBlank(message = "title is required")
          @Size(max = 100, message = "title must be at most 100 characters")
          String title,
      @NotBlank(message = "content is required") String content) {}

  public record WorkoutsResponse(List<WorkoutResponse> workouts) {}

  public record WorkoutResponse(
      UUID id, String title, String content, String authorSubjectId, Instant createdAt) {

    public static WorkoutResponse from(Workout workout) {
      return new WorkoutResponse(
          workout.getId(),
          workout.getTitle(),
          workout.getContent(),
          workout.getAuthorSubjectId(),
          workout.getCreatedAt());
    }
  }

  public record CreateWorkoutResponse(WorkoutResponse workout, String message) {}
}
