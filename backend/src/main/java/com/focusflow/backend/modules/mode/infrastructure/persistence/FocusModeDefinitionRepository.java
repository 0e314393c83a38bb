package com.focusflow.backend.modules.mode.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.focusflow.backend.modules.mode.domain.FocusModeDefinition;

import org.springframework.data.jpa.repository.JpaRepository;

public interface FocusModeDefinitionRepository extends JpaRepository<FocusModeDefinition, Long> {

    List<FocusModeDefinition> findAllByOrderByDurationMinutesAscNameAsc();

    Optional<FocusModeDefinition> findBySlug(String slug);

    boolean existsBySlugOrNameIgnoreCase(String slug, String name);
}
