package com.raditha.signfix.alias;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Name to value table with recursive, cycle-guarded resolution.
 * <p>
 * Resolution substitutes every identifier token of a definition that is itself defined in the
 * table. A visited set stops self and mutual references; {@link #MAX_RESOLUTION_DEPTH} bounds
 * the nesting and {@link #MAX_RESOLVED_LENGTH} the size of a resolved value. Any stop leaves the
 * partially resolved text in place and sets {@link AliasResolution#cycleDetected()}. Within one
 * resolution each name is resolved at most once. Subclasses only parse definitions; the table
 * is read-only once {@link #finish(List)} has run.
 */
public abstract class AliasTable {

    private static final Logger logger = LoggerFactory.getLogger(AliasTable.class);

    public static final int MAX_RESOLUTION_DEPTH = 50;
    public static final int MAX_RESOLVED_LENGTH = 8192;

    private static final Pattern NAME_TOKEN = Pattern.compile("\\b([A-Za-z_][A-Za-z0-9_]*)\\b");

    private final String sourceFile;
    private final Map<String, String> definitions = new LinkedHashMap<>();
    private final Map<String, AliasResolution> cache = new HashMap<>();
    private final Map<String, AliasEntry> entries = new LinkedHashMap<>();

    protected AliasTable(String sourceFile) {
        this.sourceFile = sourceFile;
    }

    /**
     * Register a raw definition. A later definition of the same name replaces the earlier one.
     */
    protected void define(String name, String rawValue) {
        definitions.put(name, rawValue == null ? "" : rawValue.trim());
    }

    /**
     * Resolve every definition and collect usage lines from the source text.
     */
    protected void finish(List<String> sourceLines) {
        Map<String, List<Integer>> usages = collectUsages(sourceLines);
        for (String name : definitions.keySet()) {
            AliasResolution r = resolve(name);
            if (r.cycleDetected()) {
                logger.debug("Resolution of {} stopped on a cycle, keeping '{}'", name, r.value());
            }
            entries.put(name, new AliasEntry(name, r.value(), new TreeSet<>(r.related()), sourceFile,
                    usages.getOrDefault(name, List.of())));
        }
    }

    /**
     * Resolve a defined name. Names not in the table resolve to themselves.
     */
    public AliasResolution resolve(String name) {
        if (!definitions.containsKey(name)) {
            return AliasResolution.unresolved(name);
        }
        return resolveName(name, new HashSet<>(), 0, new HashMap<>());
    }

    /**
     * Resolve every defined name appearing in arbitrary text, for example {@code "const MyU8"}.
     */
    public AliasResolution resolveSpelling(String text) {
        if (text == null || text.isBlank()) {
            return AliasResolution.unresolved(text == null ? "" : text.trim());
        }
        return substitute(text, new HashSet<>(), 0, new HashMap<>());
    }

    private AliasResolution resolveName(String name, Set<String> seen, int depth,
                                        Map<String, AliasResolution> memo) {
        AliasResolution cached = cache.get(name);
        if (cached == null) {
            cached = memo.get(name);
        }
        if (cached != null) {
            return cached;
        }
        String raw = definitions.get(name);
        if (depth > MAX_RESOLUTION_DEPTH) {
            return new AliasResolution(raw, Set.of(), true);
        }
        if (isFixpoint(name, raw)) {
            AliasResolution self = AliasResolution.unresolved(raw);
            cache.put(name, self);
            return self;
        }
        Set<String> visiting = new HashSet<>(seen);
        visiting.add(name);
        AliasResolution result = substitute(raw, visiting, depth + 1, memo);
        if (result.cycleDetected()) {
            memo.put(name, result);
        } else {
            cache.put(name, result);
        }
        return result;
    }

    private AliasResolution substitute(String text, Set<String> seen, int depth,
                                       Map<String, AliasResolution> memo) {
        Set<String> related = new HashSet<>();
        boolean cycle = false;
        Matcher m = NAME_TOKEN.matcher(text);
        StringBuilder out = new StringBuilder();
        int copied = 0;
        while (m.find()) {
            String token = m.group(1);
            String replacement = token;
            if (definitions.containsKey(token) && !isFixpoint(token, definitions.get(token))) {
                if (seen.contains(token)) {
                    cycle = true;
                } else {
                    AliasResolution inner = resolveName(token, seen, depth, memo);
                    related.add(token);
                    related.addAll(inner.related());
                    cycle |= inner.cycleDetected();
                    replacement = inner.value();
                }
            }
            if (out.length() + (m.start() - copied) + replacement.length() > MAX_RESOLVED_LENGTH) {
                replacement = token;
                cycle = true;
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
            copied = m.end();
        }
        m.appendTail(out);
        return new AliasResolution(normalizeValue(out.toString()), related, cycle);
    }

    /**
     * A definition that is its own value (seeded primitive types) never substitutes.
     */
    private static boolean isFixpoint(String name, String raw) {
        return name.equals(raw);
    }

    protected String normalizeValue(String value) {
        return value.trim();
    }

    private Map<String, List<Integer>> collectUsages(List<String> lines) {
        Map<String, List<Integer>> usages = new HashMap<>();
        Map<String, Pattern> patterns = new HashMap<>();
        for (String name : definitions.keySet()) {
            patterns.put(name, Pattern.compile("(?<![\\w])" + Pattern.quote(name) + "(?![\\w])"));
        }
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            for (Map.Entry<String, Pattern> p : patterns.entrySet()) {
                if (p.getValue().matcher(line).find()) {
                    usages.computeIfAbsent(p.getKey(), k -> new ArrayList<>()).add(i + 1);
                }
            }
        }
        return usages;
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    public Optional<AliasEntry> lookup(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    /**
     * Resolved value of a defined name, or null.
     */
    public String resolvedValue(String name) {
        AliasEntry entry = entries.get(name);
        return entry == null ? null : entry.resolvedValue();
    }

    /**
     * Raw (unsubstituted) definition of a name, or null.
     */
    public String rawValue(String name) {
        return definitions.get(name);
    }

    public String sourceFile() {
        return sourceFile;
    }

    public int size() {
        return definitions.size();
    }
}
