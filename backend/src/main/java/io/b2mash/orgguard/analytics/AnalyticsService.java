package io.b2mash.orgguard.analytics;

import io.b2mash.orgguard.member.MemberRepository;
import io.b2mash.orgguard.workout.WorkoutService;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AnalyticsService {

  private final MemberRepository memberRepository;
  private final WorkoutService workoutService;

  public AnalyticsService(MemberRepository memberRepository, WorkoutService workoutService) {
    this.memberRepository = memberRepository;
    this.workoutService = workoutService;
  }

  @Transactional(readOnly = true)
  public MemberAnalytics memberAnalytics(String organizationId) {
    Map<String, Long> distribution = new LinkedHashMap<>();
    for (var row : memberRepository.countByRole(organizationId)) {
      distribution.put(row.getRole(), row.getCount());
    }
    long memberCount = memberRepository.countByOrganizationId(organizationId);
    return new MemberAnalytics(memberCount, distribution);
  }

  @Transactional(readOnly = true)
  public AdminStats adminStats(String organizationId) {
    return new AdminStats(
        memberRepository.countByOrganizationId(organizationId),
        workoutService.countWorkouts(organizationId));
  }

  public record MemberAnalytics(long memberCount, Map<String, Long> roleDistribution) {}

  public record AdminStats(long totalMembers, long totalWorkouts) {}
}
