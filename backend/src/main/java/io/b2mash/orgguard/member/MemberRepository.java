package io.b2mash.orgguard.member;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MemberRepository extends JpaRepository<Member, UUID> {

  Optional<Member> findBySubjectIdAndOrganizationId(String subjectId, String organizationId);

  List<Member> findBySubjectId(String subjectId);

  List<Member> findByOrganizationIdOrderByCreatedAtAsc(String organizationId);

  long countByOrganizationId(String organizationId);

  @Query(
      "SELECT m.role AS role, COUNT(m) AS count FROM Member m"
          + " WHERE m.organizationId = :organizationId GROUP BY m.role ORDER BY m.role")
  List<RoleCountProjection> countByRole(@Param("organizationId") String organizationId);

  interface RoleCountProjection {
    String getRole();

    Long getCount();
  }
}
