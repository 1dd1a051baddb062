package io.hireflow.forms.repo;

import io.hireflow.forms.domain.FormTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface FormTemplateRepository extends JpaRepository<FormTemplate, UUID> {

    Optional<FormTemplate> findByIdAndOrganizationId(UUID id, UUID organizationId);

    @Query("""
            SELECT t
              FROM FormTemplate t
             WHERE t.organizationId = :organizationId
               AND (t.published = true OR t.createdBy = :recruiterId)
             ORDER BY t.createdAt DESC
            """)
    List<FormTemplate> findVisibleTo(UUID organizationId, UUID recruiterId);
}
