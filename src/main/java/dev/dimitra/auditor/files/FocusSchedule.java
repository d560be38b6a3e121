package dev.dimitra.auditor.files;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves schedule entries ("security", "off", "all", "does_it_work", "docs,testing")
 * to focus area names. Frames group focus areas under one question.
 */
public final class FocusSchedule {

    public static final String OFF = "off";
    public static final String ALL = "all";

    public static final Map<String, List<String>> FRAMES;

    static {
        Map<String, List<String>> frames = new LinkedHashMap<>();
        frames.put("does_it_work", List.of("security", "testing"));
        frames.put("does_it_feel_right", List.of());
        frames.put("can_everyone_use_it", List.of());
        frames.put("does_it_last", List.of("patterns", "hygiene", "docs", "dependencies"));
        frames.put("can_we_prove_it", List.of("performance"));
        FRAMES = Map.copyOf(frames);
    }

    private FocusSchedule() {}

    public static Map<DayOfWeek, String> defaultWeek() {
        Map<DayOfWeek, String> week = new EnumMap<>(DayOfWeek.class);
        week.put(DayOfWeek.MONDAY, "security");
        week.put(DayOfWeek.TUESDAY, "patterns");
        week.put(DayOfWeek.WEDNESDAY, "docs");
        week.put(DayOfWeek.THURSDAY, "hygiene");
        week.put(DayOfWeek.FRIDAY, "performance");
        week.put(DayOfWeek.SATURDAY, "dependencies");
        week.put(DayOfWeek.SUNDAY, OFF);
        return week;
    }

    public static List<String> resolve(String entry) {
        return resolve(entry, Map.of());
    }

    /**
     * @param frameOverrides per frame, focus names mapped to false are dropped from that frame
     */
    public static List<String> resolve(String entry, Map<String, Map<String, Boolean>> frameOverrides) {
        if (entry == null) return List.of();
        String raw = entry.trim().toLowerCase(Locale.ROOT);
        if (raw.isEmpty() || raw.equals(OFF) || raw.equals("false")) return List.of();
        if (raw.equals(ALL) || raw.equals("true")) return FocusArea.allNames();

        List<String> out = new ArrayList<>();
        if (raw.contains(",")) {
            for (String part : raw.split(",")) {
                if (!part.isBlank()) out.addAll(resolve(part, frameOverrides));
            }
            return out;
        }
        if (FRAMES.containsKey(raw)) {
            Map<String, Boolean> overrides = frameOverrides.getOrDefault(raw, Map.of());
            for (String f : FRAMES.get(raw)) {
                if (overrides.getOrDefault(f, Boolean.TRUE)) out.add(f);
            }
            return out;
        }
        out.add(raw);
        return out;
    }

    /** Number of active (non-off) days in a weekly schedule. */
    public static int activeDays(Map<DayOfWeek, String> week) {
        int n = 0;
        for (String v : week.values()) {
            if (!resolve(v).isEmpty()) n++;
        }
        return n;
    }
}
