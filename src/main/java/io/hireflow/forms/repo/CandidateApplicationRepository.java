package io.hireflow.forms.repo;

import io.hireflow.forms.domain.CandidateApplication;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CandidateApplicationRepository extends JpaRepository<CandidateApplication, UUID> {
}
