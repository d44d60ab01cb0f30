package foreman.coordinator.decompose;

import foreman.coordinator.model.Priority;
import foreman.coordinator.model.TaskDescription;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based decomposition of a requirements document: one task per actionable line.
 *
 * <p>Headers, section names and lines shorter than ten characters are skipped. A leading
 * action verb ("create", "add", "fix" ...) shapes the title; keywords decide priority and
 * the files the task is expected to touch. Tasks carry no dependencies and no ids.
 */
public final class LineItemDecomposer implements Decomposer {

    private static final Pattern LIST_PREFIX = Pattern.compile("^[\\s\\-*•\\d.)]+\\s*");
    private static final Set<String> SECTION_NAMES = Set.of("overview", "summary", "introduction");
    private static final int MIN_LINE_LENGTH = 10;
    private static final int MAX_FALLBACK_TITLE = 50;

    private static final List<String> ACTIONS = List.of(
            "Create", "Build", "Implement", "Add", "Develop", "Design", "Configure", "Setup",
            "Integrate", "Modify", "Update", "Fix", "Refactor", "Test", "Verify");
    private static final Map<String, Pattern> ACTION_PATTERNS = new LinkedHashMap<>();

    // keywords match at the start of a word: "auth" hits "authentication", "ui" does not hit "build"
    private static final Pattern HIGH_PRIORITY = keywords(
            "auth", "security", "critical", "login", "password", "payment", "database");
    private static final Pattern LOW_PRIORITY = keywords(
            "cosmetic", "ui", "style", "color", "font", "documentation", "readme");

    private static final Map<Pattern, List<String>> TARGETS = new LinkedHashMap<>();

    static {
        for (String action : ACTIONS) {
            ACTION_PATTERNS.put(action, Pattern.compile("\\b" + action + "\\s+(.+)", Pattern.CASE_INSENSITIVE));
        }

        TARGETS.put(keywords("api", "endpoint", "server", "backend"),
                List.of("api/main.py", "api/routes.py"));
        TARGETS.put(keywords("ui", "interface", "component", "frontend", "web"),
                List.of("frontend/index.html", "frontend/style.css", "frontend/script.js"));
        TARGETS.put(keywords("database", "model", "schema", "sql"),
                List.of("database/models.py", "database/migrations.py"));
        TARGETS.put(keywords("test", "testing", "spec"),
                List.of("tests/test_implementation.py", "tests/conftest.py"));
        TARGETS.put(keywords("config", "configuration", "settings"),
                List.of("config/settings.py", "config/environment.py"));
        TARGETS.put(keywords("auth", "login", "user", "authentication"),
                List.of("auth/user.py", "auth/middleware.py", "auth/routes.py"));
        TARGETS.put(keywords("docker", "deploy", "deployment"),
                List.of("Dockerfile", "docker-compose.yml", "deploy.sh"));
    }

    private static final List<String> DEFAULT_TARGETS = List.of("src/main.py", "src/utils.py");

    @Override
    public List<TaskDescription> decompose(String goal) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("goal is empty");
        }

        List<TaskDescription> tasks = new ArrayList<>();
        int counter = 1;
        for (String raw : goal.split("\n")) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#") || SECTION_NAMES.contains(line.toLowerCase(Locale.ROOT))) {
                continue;
            }
            String clean = LIST_PREFIX.matcher(line).replaceFirst("").strip();
            if (clean.length() < MIN_LINE_LENGTH) {
                continue;
            }

            String title;
            String instruction;
            String[] action = matchAction(clean);
            if (action != null) {
                String target = action[1].strip().replaceAll("\\s+", "_").toLowerCase(Locale.ROOT)
                        .replaceAll("[^\\w\\-]", "");
                String words = target.replace('_', ' ');
                title = action[0] + " " + titleCase(words);
                instruction = action[0] + " " + words;
            } else {
                title = clean.length() > MAX_FALLBACK_TITLE ? clean.substring(0, MAX_FALLBACK_TITLE) + "..." : clean;
                instruction = clean;
            }

            String slug = title.toLowerCase(Locale.ROOT).replace(' ', '-');
            String branch = String.format("feature/task-%02d-%s", counter, slug.substring(0, Math.min(20, slug.length())));

            tasks.add(new TaskDescription(null, title, instruction, branch,
                    targetsFor(clean), priorityOf(clean).wireName(), List.of()));
            counter++;
        }

        if (tasks.isEmpty()) {
            throw new IllegalArgumentException("goal contains no actionable lines");
        }
        return tasks;
    }

    /** HIGH for risky areas, LOW for cosmetic ones, MEDIUM otherwise */
    static Priority priorityOf(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        if (HIGH_PRIORITY.matcher(lower).find()) {
            return Priority.HIGH;
        }
        if (LOW_PRIORITY.matcher(lower).find()) {
            return Priority.LOW;
        }
        return Priority.MEDIUM;
    }

    static List<String> targetsFor(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, List<String>> entry : TARGETS.entrySet()) {
            if (entry.getKey().matcher(lower).find()) {
                return entry.getValue();
            }
        }
        return DEFAULT_TARGETS;
    }

    /** {verb, rest of line} for the first action verb found, or null */
    private static String[] matchAction(String line) {
        for (Map.Entry<String, Pattern> entry : ACTION_PATTERNS.entrySet()) {
            Matcher m = entry.getValue().matcher(line);
            if (m.find()) {
                return new String[] { entry.getKey(), m.group(1) };
            }
        }
        return null;
    }

    private static Pattern keywords(String... words) {
        StringJoiner alternatives = new StringJoiner("|", "\\b(?:", ")");
        for (String word : words) {
            alternatives.add(Pattern.quote(word));
        }
        return Pattern.compile(alternatives.toString());
    }

    private static String titleCase(String words) {
        StringBuilder sb = new StringBuilder(words.length());
        boolean startOfWord = true;
        for (char c : words.toCharArray()) {
            sb.append(startOfWord ? Character.toUpperCase(c) : c);
            startOfWord = !Character.isLetterOrDigit(c);
        }
        return sb.toString();
    }
}
