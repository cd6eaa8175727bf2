package com.talent.match.utils.basic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.talent.match.exceptions.BadRequestException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;


@Slf4j
public final class BasicUtility {
    private static final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private BasicUtility() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static String stringifyObject(Object o) {
        try {
            return om.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new BadRequestException("Failed stringifying object");
        }
    }

    public static <T> T safeParse(String payload, Class<T> clazz) {
        try {
            return om.readValue(payload, clazz);
        } catch (Exception e) {
            log.debug("Failed to parse payload into {}: {}", clazz.getSimpleName(), payload);
            return null;
        }
    }

    /**
     * Lower-cases and trims skill names, dropping blanks and duplicates while keeping first-seen order.
     */
    public static List<String> normalizeSkills(Collection<String> skills) {
        if (skills == null || skills.isEmpty()) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        skills.stream()
                .filter(Objects::nonNull)
                .map(BasicUtility::normalizeSkill)
                .filter(StringUtils::isNotEmpty)
                .forEach(normalized::add);
        return List.copyOf(normalized);
    }

    public static String normalizeSkill(String skill) {
        return StringUtils.trimToEmpty(skill).toLowerCase(Locale.ROOT);
    }

    public static String categoryOrDefault(String category) {
        return StringUtils.isBlank(category) ? Constant.DEFAULT_CATEGORY : category.trim();
    }
}
