package com.prism.core.loader;

import com.prism.api.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 版本约束：逗号分隔的比较子句，全部满足才算满足
 * <p>
 * 支持 ==、!=、&gt;=、&lt;=、&gt;、&lt;、~=（兼容版本），== 与 != 支持 1.* 通配；
 * 省略运算符等同于 ==，单独的 * 匹配任意版本。
 * </p>
 */
public final class VersionConstraint {

    private static final Pattern CLAUSE = Pattern.compile("^(~=|==|!=|>=|<=|>|<)?\\s*(\\S+)$");

    private final String text;
    private final List<Clause> clauses;

    private VersionConstraint(String text, List<Clause> clauses) {
        this.text = text;
        this.clauses = clauses;
    }

    /**
     * @throws ConfigurationException 约束无法解析
     */
    public static VersionConstraint parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("Empty version constraint");
        }
        List<Clause> clauses = new ArrayList<>();
        for (String raw : text.split(",")) {
            String part = raw.trim();
            if (part.isEmpty()) {
                throw new ConfigurationException("Empty clause in version constraint '" + text + "'");
            }
            if (part.equals("*")) {
                continue;
            }
            Matcher m = CLAUSE.matcher(part);
            if (!m.matches()) {
                throw new ConfigurationException("Invalid version constraint clause '" + part + "'");
            }
            String op = m.group(1) == null ? "==" : m.group(1);
            clauses.add(Clause.of(op, m.group(2)));
        }
        return new VersionConstraint(text.trim(), List.copyOf(clauses));
    }

    public boolean isSatisfiedBy(Version version) {
        for (Clause clause : clauses) {
            if (!clause.test(version)) {
                return false;
            }
        }
        return true;
    }

    public boolean isSatisfiedBy(String version) {
        return isSatisfiedBy(Version.parse(version));
    }

    @Override
    public String toString() {
        return text;
    }

    private record Clause(String op, Version version, List<Integer> wildcardPrefix) {

        static Clause of(String op, String operand) {
            if (operand.endsWith(".*")) {
                if (!op.equals("==") && !op.equals("!=")) {
                    throw new ConfigurationException("Wildcard only allowed with == or !=: '" + op + operand + "'");
                }
                Version prefix = Version.parse(operand.substring(0, operand.length() - 2));
                return new Clause(op, prefix, prefix.release());
            }
            Version version = Version.parse(operand);
            if (op.equals("~=") && version.release().size() < 2) {
                throw new ConfigurationException("~= requires at least two version segments: '" + operand + "'");
            }
            return new Clause(op, version, null);
        }

        boolean test(Version candidate) {
            if (wildcardPrefix != null) {
                boolean prefixMatch = startsWith(candidate, wildcardPrefix);
                return op.equals("==") == prefixMatch;
            }
            int cmp = candidate.compareTo(version);
            return switch (op) {
                case "==" -> cmp == 0;
                case "!=" -> cmp != 0;
                case ">=" -> cmp >= 0;
                case "<=" -> cmp <= 0;
                case ">" -> cmp > 0;
                case "<" -> cmp < 0;
                case "~=" -> cmp >= 0
                        && startsWith(candidate, version.release().subList(0, version.release().size() - 1));
                default -> throw new IllegalStateException("Unknown operator " + op);
            };
        }

        private static boolean startsWith(Version candidate, List<Integer> prefix) {
            for (int i = 0; i < prefix.size(); i++) {
                if (candidate.segment(i) != prefix.get(i)) {
                    return false;
                }
            }
            return true;
        }
    }
}
