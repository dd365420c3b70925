package com.volunteermedia.service;

import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.AnimalComment;
import com.volunteermedia.model.AnimalStatus;
import com.volunteermedia.model.CommentTag;
import com.volunteermedia.model.SessionMetadata;
import com.volunteermedia.repository.AnimalCommentRepository;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.GroupRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.volunteermedia.repository.CommentSpecifications.active;
import static com.volunteermedia.repository.CommentSpecifications.forAnimal;
import static com.volunteermedia.repository.CommentSpecifications.inGroup;
import static com.volunteermedia.repository.CommentSpecifications.taggedWithAny;

/**
 * CSV import and export of animals, and export of comments for offline analysis.
 *
 * IMPORT:
 * =======
 * - Header names are matched case-insensitively; {@code group_id} and {@code name} are required
 *   unless a group override is given, in which case only {@code name} is
 * - Bad rows are skipped and reported as "Line N: ..." warnings; line numbers count the header
 * - A {@code group_id} naming a missing or deleted group is a bad row
 * - Missing or empty status means "available"; an unparseable age or birth date is ignored
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnimalCsvService {

    static final String[] ANIMAL_COLUMNS = {
            "id", "group_id", "name", "species", "breed", "age", "estimated_birth_date",
            "description", "trainer_notes", "status", "image_url"
    };

    static final String[] COMMENT_COLUMNS = {
            "comment_id", "animal_id", "animal_name", "group_id", "author", "content", "tags",
            "session_goal", "session_outcome", "session_rating", "created_at"
    };

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final AnimalRepository animalRepository;
    private final AnimalCommentRepository commentRepository;
    private final GroupRepository groupRepository;

    /**
     * Outcome of an import: how many rows were saved and the rows that were skipped.
     */
    public record ImportResult(int count, List<String> warnings) {
    }

    // ==================== EXPORT ====================

    @Transactional(readOnly = true)
    public String exportAnimals(Long groupId) {
        List<Animal> animals = groupId != null
                ? animalRepository.findByGroupIdAndDeletedAtIsNullOrderByNameAsc(groupId)
                : animalRepository.findByDeletedAtIsNullOrderByGroupIdAscNameAsc();

        return write(ANIMAL_COLUMNS, printer -> {
            for (Animal a : animals) {
                printer.printRecord(
                        a.getId(),
                        a.getGroupId(),
                        a.getName(),
                        a.getSpecies(),
                        a.getBreed(),
                        a.getAge(),
                        a.getEstimatedBirthDate() != null ? DATE.format(a.getEstimatedBirthDate()) : "",
                        a.getDescription(),
                        a.getTrainerNotes(),
                        a.getStatus().getValue(),
                        a.getImageUrl());
            }
        });
    }

    @Transactional(readOnly = true)
    public String exportComments(Long groupId, Long animalId, Collection<String> tagNames) {
        Specification<AnimalComment> spec = Specification.where(active())
                .and(inGroup(groupId))
                .and(forAnimal(animalId))
                .and(taggedWithAny(tagNames));
        List<AnimalComment> comments = commentRepository.findAll(spec, Sort.by(Sort.Direction.DESC, "createdAt"));

        Map<Long, Animal> animals = animalRepository.findAllById(
                        comments.stream().map(AnimalComment::getAnimalId).distinct().collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(Animal::getId, Function.identity()));

        return write(COMMENT_COLUMNS, printer -> {
            for (AnimalComment c : comments) {
                Animal animal = animals.get(c.getAnimalId());
                SessionMetadata metadata = c.getMetadata();
                printer.printRecord(
                        c.getId(),
                        c.getAnimalId(),
                        animal != null ? animal.getName() : "",
                        animal != null ? animal.getGroupId() : "",
                        c.getUser() != null ? c.getUser().getUsername() : "",
                        c.getContent(),
                        c.getTags().stream()
                                .map(CommentTag::getName)
                                .sorted(Comparator.naturalOrder())
                                .collect(Collectors.joining(";")),
                        metadata != null ? metadata.getSessionGoal() : "",
                        metadata != null ? metadata.getSessionOutcome() : "",
                        metadata != null && metadata.getSessionRating() != null ? metadata.getSessionRating() : "",
                        c.getCreatedAt());
            }
        });
    }

    // ==================== IMPORT ====================

    @Transactional
    public ImportResult importAnimals(String fileName, InputStream content, Long groupOverride) {
        if (fileName == null || !fileName.toLowerCase().endsWith(".csv")) {
            throw new BadRequestException("File must be a CSV file");
        }
        if (groupOverride != null && groupRepository.findByIdAndDeletedAtIsNull(groupOverride).isEmpty()) {
            throw new BadRequestException("Invalid group_id");
        }

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreHeaderCase(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true)
                .build();

        List<Animal> animals = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        try (Reader reader = new InputStreamReader(content, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {

            Map<String, Integer> header = parser.getHeaderMap();
            if (header == null || header.isEmpty()) {
                throw new BadRequestException("Failed to read CSV header");
            }
            if (groupOverride == null && !hasColumn(header, "group_id")) {
                throw new BadRequestException("Missing required column: group_id");
            }
            if (!hasColumn(header, "name")) {
                throw new BadRequestException("Missing required column: name");
            }

            Instant now = Instant.now();
            Map<Long, Boolean> knownGroups = new HashMap<>();
            for (CSVRecord record : parser) {
                long line = record.getRecordNumber() + 1;
                Animal animal = toAnimal(record, line, groupOverride, now, knownGroups, warnings);
                if (animal != null) {
                    animals.add(animal);
                }
            }
        } catch (IOException | UncheckedIOException | IllegalStateException | IllegalArgumentException e) {
            log.warn("Failed to parse CSV upload {}: {}", fileName, e.getMessage());
            throw new BadRequestException("Failed to read CSV file");
        }

        if (animals.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("errors", warnings);
            throw new BadRequestException("No valid animals to import", details);
        }

        animalRepository.saveAll(animals);
        log.info("Imported {} animals from {} ({} rows skipped)", animals.size(), fileName, warnings.size());
        return new ImportResult(animals.size(), warnings);
    }

    private Animal toAnimal(CSVRecord record, long line, Long groupOverride, Instant now,
                            Map<Long, Boolean> knownGroups, List<String> warnings) {
        Long groupId = groupOverride;
        if (groupId == null) {
            String raw = value(record, "group_id");
            try {
                groupId = Long.parseLong(raw);
            } catch (NumberFormatException e) {
                warnings.add("Line " + line + ": Invalid group_id '" + raw + "'");
                return null;
            }
            if (groupId <= 0 || !knownGroups.computeIfAbsent(groupId, this::groupExists)) {
                warnings.add("Line " + line + ": Invalid group_id '" + raw + "'");
                return null;
            }
        }

        String name = value(record, "name");
        if (name.isEmpty()) {
            warnings.add("Line " + line + ": Name is required");
            return null;
        }

        AnimalStatus status = AnimalStatus.AVAILABLE;
        String rawStatus = value(record, "status");
        if (!rawStatus.isEmpty()) {
            status = AnimalStatus.parse(rawStatus).orElse(null);
            if (status == null) {
                warnings.add("Line " + line + ": Invalid status '" + rawStatus + "'");
                return null;
            }
        }

        Animal animal = new Animal();
        animal.setGroupId(groupId);
        animal.setName(name);
        animal.setSpecies(value(record, "species"));
        animal.setBreed(value(record, "breed"));
        animal.setDescription(value(record, "description"));
        animal.setTrainerNotes(value(record, "trainer_notes"));
        animal.setImageUrl(value(record, "image_url"));
        animal.setArrivalDate(now);
        animal.setLastStatusChange(now);
        AnimalService.applyStatusChange(animal, status, null, now);

        String age = value(record, "age");
        if (!age.isEmpty()) {
            try {
                animal.setAge(Integer.parseInt(age));
            } catch (NumberFormatException e) {
                log.debug("Ignoring unparseable age '{}' on line {}", age, line);
            }
        }

        String birthDate = value(record, "estimated_birth_date");
        if (!birthDate.isEmpty()) {
            try {
                LocalDate parsed = LocalDate.parse(birthDate, DATE);
                animal.setEstimatedBirthDate(parsed);
                animal.setAge(AnimalService.ageFromBirthDate(parsed));
            } catch (DateTimeParseException e) {
                log.debug("Ignoring unparseable birth date '{}' on line {}", birthDate, line);
            }
        }
        return animal;
    }

    private boolean groupExists(Long groupId) {
        return groupRepository.findByIdAndDeletedAtIsNull(groupId).isPresent();
    }

    private static boolean hasColumn(Map<String, Integer> header, String column) {
        return header.keySet().stream().anyMatch(h -> h != null && h.trim().equalsIgnoreCase(column));
    }

    private static String value(CSVRecord record, String column) {
        if (!record.isMapped(column) || !record.isSet(column)) {
            return "";
        }
        String value = record.get(column);
        return value == null ? "" : value.trim();
    }

    @FunctionalInterface
    private interface RowWriter {
        void write(CSVPrinter printer) throws IOException;
    }

    private static String write(String[] columns, RowWriter rows) {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.builder().setHeader(columns).build())) {
            rows.write(printer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV", e);
        }
        return out.toString();
    }
}
