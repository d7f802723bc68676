package com.tailorai.infrastructure.ai.render;

import com.tailorai.domain.resume.model.*;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a rendered markdown resume back into a profile so the final document can be
 * rescored exactly as a reader would see it.
 */
@Component
public class MarkdownProfileExtractor {

    private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w-]+(\\.[\\w-]+)+");
    private static final Pattern PHONE = Pattern.compile("^\\+?[\\d\\s().-]{7,}$");
    private static final Pattern DATE_RANGE = Pattern.compile("^\\*(.*?)\\s+-\\s+(.*?)\\*$");
    private static final Pattern SKILL_LINE = Pattern.compile("^(Technical|Tools|Soft)\\s*:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final String COURSEWORK_PREFIX = "Relevant Coursework:";

    public CandidateProfile extract(String markdown) {
        Map<String, List<String>> sections = splitSections(markdown);

        return new CandidateProfile(
                parseBasics(sections.getOrDefault("", List.of())),
                parseSummary(sections.getOrDefault("summary", List.of())),
                parseSkills(sections.getOrDefault("skills", List.of())),
                parseExperience(sections.getOrDefault("experience", List.of())),
                parseEducation(sections.getOrDefault("education", List.of())),
                parseProjects(sections.getOrDefault("projects", List.of())),
                List.of(),
                parseCommunity(sections.getOrDefault("community", List.of())));
    }

    // Lines grouped by "## " section, keyed by lowercased title; "" holds the header block
    private Map<String, List<String>> splitSections(String markdown) {
        Map<String, List<String>> sections = new LinkedHashMap<>();
        String current = "";
        sections.put(current, new ArrayList<>());
        for (String line : markdown.split("\n")) {
            if (line.startsWith("## ")) {
                current = line.substring(3).strip().toLowerCase(Locale.ROOT);
                sections.putIfAbsent(current, new ArrayList<>());
            } else {
                sections.get(current).add(line);
            }
        }
        return sections;
    }

    private ContactBasics parseBasics(List<String> lines) {
        String name = null;
        String email = null;
        String phone = null;
        String location = null;
        String linkedin = null;

        for (String line : lines) {
            if (line.startsWith("# ")) {
                name = line.substring(2).strip();
                continue;
            }
            for (String part : line.split("\\|")) {
                String value = part.strip();
                if (value.isEmpty()) {
                    continue;
                }
                if (email == null && EMAIL.matcher(value).find()) {
                    email = value;
                } else if (phone == null && PHONE.matcher(value).matches()) {
                    phone = value;
                } else if (linkedin == null && value.toLowerCase(Locale.ROOT).contains("linkedin")) {
                    linkedin = value;
                } else if (location == null) {
                    location = value;
                }
            }
        }
        return new ContactBasics(name, email, phone, location, linkedin);
    }

    private String parseSummary(List<String> lines) {
        String summary = String.join("\n", lines).strip();
        return summary.isEmpty() ? null : summary;
    }

    private SkillSet parseSkills(List<String> lines) {
        List<String> technical = new ArrayList<>();
        List<String> tools = new ArrayList<>();
        List<String> soft = new ArrayList<>();

        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            Matcher m = SKILL_LINE.matcher(line.strip());
            if (!m.matches()) {
                technical.addAll(splitList(line));
                continue;
            }
            switch (m.group(1).toLowerCase(Locale.ROOT)) {
                case "tools" -> tools.addAll(splitList(m.group(2)));
                case "soft" -> soft.addAll(splitList(m.group(2)));
                default -> technical.addAll(splitList(m.group(2)));
            }
        }
        return new SkillSet(technical, tools, soft);
    }

    private List<ExperienceEntry> parseExperience(List<String> lines) {
        List<ExperienceEntry> entries = new ArrayList<>();
        for (Block block : blocks(lines)) {
            String[] heading = splitHeading(block.heading());
            String start = null;
            String end = null;
            String location = null;
            for (String line : block.body()) {
                for (String part : line.split("\\|")) {
                    String value = part.strip();
                    Matcher dates = DATE_RANGE.matcher(value);
                    if (dates.matches()) {
                        start = emptyToNull(dates.group(1));
                        end = emptyToNull(dates.group(2));
                    } else if (start != null || end != null) {
                        location = emptyToNull(value);
                    }
                }
            }
            entries.add(new ExperienceEntry(heading[0], heading[1], start, end, location, block.bullets(), null));
        }
        return entries;
    }

    private List<EducationEntry> parseEducation(List<String> lines) {
        List<EducationEntry> entries = new ArrayList<>();
        for (Block block : blocks(lines)) {
            String degree = null;
            String start = null;
            String end = null;
            String coursework = null;
            for (String line : block.body()) {
                if (line.startsWith(COURSEWORK_PREFIX)) {
                    coursework = emptyToNull(line.substring(COURSEWORK_PREFIX.length()).strip());
                    continue;
                }
                for (String part : line.split("\\|")) {
                    String value = part.strip();
                    Matcher dates = DATE_RANGE.matcher(value);
                    if (dates.matches()) {
                        start = emptyToNull(dates.group(1));
                        end = emptyToNull(dates.group(2));
                    } else if (degree == null) {
                        degree = emptyToNull(value);
                    }
                }
            }
            entries.add(new EducationEntry(block.heading(), degree, start, end, coursework));
        }
        return entries;
    }

    private List<ProjectEntry> parseProjects(List<String> lines) {
        List<ProjectEntry> projects = new ArrayList<>();
        for (Block block : blocks(lines)) {
            String description = emptyToNull(String.join(" ", block.body()).strip());
            projects.add(new ProjectEntry(block.heading(), description, block.bullets()));
        }
        return projects;
    }

    private List<CommunityEntry> parseCommunity(List<String> lines) {
        List<CommunityEntry> community = new ArrayList<>();
        for (Block block : blocks(lines)) {
            String[] heading = splitHeading(block.heading());
            String description = emptyToNull(String.join(" ", block.body()).strip());
            community.add(new CommunityEntry(heading[1], heading[0], description));
        }
        return community;
    }

    private record Block(String heading, List<String> body, List<String> bullets) {
    }

    // "### " blocks with their non-bullet lines and "- " bullets
    private List<Block> blocks(List<String> lines) {
        List<Block> blocks = new ArrayList<>();
        String heading = null;
        List<String> body = new ArrayList<>();
        List<String> bullets = new ArrayList<>();

        for (String line : lines) {
            if (line.startsWith("### ")) {
                if (heading != null) {
                    blocks.add(new Block(heading, List.copyOf(body), List.copyOf(bullets)));
                }
                heading = line.substring(4).strip();
                body.clear();
                bullets.clear();
            } else if (heading == null || line.isBlank()) {
                continue;
            } else if (line.startsWith("- ")) {
                bullets.add(line.substring(2).strip());
            } else {
                body.add(line.strip());
            }
        }
        if (heading != null) {
            blocks.add(new Block(heading, List.copyOf(body), List.copyOf(bullets)));
        }
        return blocks;
    }

    private static String[] splitHeading(String heading) {
        int separator = heading.lastIndexOf(" - ");
        if (separator < 0) {
            return new String[]{heading, null};
        }
        return new String[]{heading.substring(0, separator).strip(), heading.substring(separator + 3).strip()};
    }

    private static List<String> splitList(String line) {
        return Arrays.stream(line.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
