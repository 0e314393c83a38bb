package com.focusflow.backend.modules.mode.application;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.focusflow.backend.global.error.ProblemException;
import com.focusflow.backend.modules.mode.domain.FocusModeDefinition;
import com.focusflow.backend.modules.mode.infrastructure.persistence.FocusModeDefinitionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class FocusModeCatalogService {

    private static final Logger log = LoggerFactory.getLogger(FocusModeCatalogService.class);

    private final FocusModeDefinitionRepository focusModeDefinitionRepository;

    public FocusModeCatalogService(FocusModeDefinitionRepository focusModeDefinitionRepository) {
        this.focusModeDefinitionRepository = focusModeDefinitionRepository;
    }

    @Transactional(readOnly = true)
    public List<FocusModeDefinition> listModes() {
        return focusModeDefinitionRepository.findAllByOrderByDurationMinutesAscNameAsc();
    }

    /**
     * Planned duration of the catalog entry with slug {@code focus}, if one is configured.
     */
    @Transactional(readOnly = true)
    public Optional<Integer> defaultDurationMinutes() {
        return focusModeDefinitionRepository.findBySlug(FocusModeDefinition.DEFAULT_SLUG)
                .map(FocusModeDefinition::getDurationMinutes)
                .filter(minutes -> minutes > 0);
    }

    public FocusModeDefinition createMode(CreateModeCommand command) {
        if (!StringUtils.hasText(command.name())) {
            throw ProblemException.validation("mode.name_required", "name is required");
        }
        if (command.durationMinutes() == null || command.durationMinutes() <= 0) {
            throw ProblemException.validation("mode.invalid_duration", "durationMinutes must be greater than 0");
        }
        String name = command.name().trim();
        String slug = normalizeSlug(StringUtils.hasText(command.slug()) ? command.slug() : name);
        if (slug.isEmpty()) {
            throw ProblemException.validation("mode.invalid_slug", "slug must contain letters or digits");
        }
        if (focusModeDefinitionRepository.existsBySlugOrNameIgnoreCase(slug, name)) {
            throw new ProblemException(HttpStatus.CONFLICT, "mode.catalog_duplicate", "a mode with this name or slug already exists");
        }

        FocusModeDefinition definition = new FocusModeDefinition();
        definition.setName(name);
        definition.setSlug(slug);
        definition.setDescription(StringUtils.hasText(command.description()) ? command.description().trim() : null);
        definition.setDurationMinutes(command.durationMinutes());
        FocusModeDefinition saved = focusModeDefinitionRepository.save(definition);
        log.info("Focus mode {} created ({} min)", saved.getSlug(), saved.getDurationMinutes());
        return saved;
    }

    static String normalizeSlug(String value) {
        return value.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
    }

    public record CreateModeCommand(
            String name,
            Integer durationMinutes,
            String description,
            String slug
    ) {
    }
}
