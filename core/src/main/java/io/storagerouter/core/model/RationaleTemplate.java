package io.storagerouter.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rationale text with {@code {placeholder}} substitution, compiled once at load time.
 *
 * <p>
 * Placeholders may name any criteria field by wire name, plus {@code rule_id} and
 * {@code priority}. Unknown placeholders are rejected at compile time so a typo
 * surfaces when the rule set loads, not in a decision.
 */
public final class RationaleTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    /** Rule metadata placeholders. */
    private enum RuleToken {
        RULE_ID,
        PRIORITY
    }

    private final String source;
    private final List<Object> parts;

    private RationaleTemplate(String source, List<Object> parts) {
        this.source = source;
        this.parts = parts;
    }

    /**
     * Compiles a template.
     *
     * @param source template text, not null
     * @return the compiled template
     * @throws IllegalArgumentException if a placeholder names nothing known
     */
    public static RationaleTemplate compile(String source) {
        Objects.requireNonNull(source, "rationale template must not be null");
        List<Object> parts = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(source);
        int last = 0;
        while (matcher.find()) {
            if (matcher.start() > last) {
                parts.add(source.substring(last, matcher.start()));
            }
            parts.add(resolve(matcher.group(1)));
            last = matcher.end();
        }
        if (last < source.length()) {
            parts.add(source.substring(last));
        }
        return new RationaleTemplate(source, List.copyOf(parts));
    }

    /** Renders the rationale for a decision made by {@code rule} on {@code criteria}. */
    public String render(Criteria criteria, Rule rule) {
        StringBuilder out = new StringBuilder(source.length() + 32);
        for (Object part : parts) {
            if (part instanceof CriteriaField field) {
                out.append(field.valueOf(criteria));
            } else if (part == RuleToken.RULE_ID) {
                out.append(rule.id());
            } else if (part == RuleToken.PRIORITY) {
                out.append(rule.priority());
            } else {
                out.append(part);
            }
        }
        return out.toString();
    }

    /** The template text as authored. */
    public String source() {
        return source;
    }

    private static Object resolve(String name) {
        if ("rule_id".equals(name)) {
            return RuleToken.RULE_ID;
        }
        if ("priority".equals(name)) {
            return RuleToken.PRIORITY;
        }
        CriteriaField field = CriteriaField.fromWire(name);
        if (field == null) {
            throw new IllegalArgumentException("Unknown rationale placeholder '{" + name + "}'");
        }
        return field;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RationaleTemplate other && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
