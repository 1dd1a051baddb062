package io.hireflow.forms.repo;

import io.hireflow.forms.domain.FormResponse;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

public interface FormResponseRepository extends JpaRepository<FormResponse, UUID> {

    Optional<FormResponse> findByInvitationId(UUID invitationId);

    Optional<FormResponse> findByIdAndOrganizationId(UUID id, UUID organizationId);

    List<FormResponse> findByApplicationIdAndOrganizationIdOrderBySubmittedAtDesc(UUID applicationId, UUID organizationId);
}
