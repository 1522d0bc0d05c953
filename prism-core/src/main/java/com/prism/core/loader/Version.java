package com.prism.core.loader;

import com.prism.api.exception.ConfigurationException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 插件版本：点分数字 + 可选预发布后缀（1.2.0、v2.0、1.0.0-beta1）
 * <p>
 * 比较时缺失的段按 0 处理；带预发布后缀的版本低于同号的正式版本。
 * </p>
 */
public record Version(List<Integer> release, String preRelease) implements Comparable<Version> {

    private static final Pattern PATTERN =
            Pattern.compile("^[vV]?(\\d+(?:\\.\\d+)*)(?:[-.+]?([A-Za-z][0-9A-Za-z.\\-]*))?$");
    private static final Pattern IDENTIFIER = Pattern.compile("\\d+|[A-Za-z]+");

    public Version {
        release = List.copyOf(release);
    }

    public static Version parse(String text) {
        if (text == null) {
            throw new ConfigurationException("Version is null");
        }
        Matcher m = PATTERN.matcher(text.trim());
        if (!m.matches()) {
            throw new ConfigurationException("Invalid version: '" + text + "'");
        }
        List<Integer> parts = new ArrayList<>();
        for (String part : m.group(1).split("\\.")) {
            try {
                parts.add(Integer.parseInt(part));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid version segment in '" + text + "'", e);
            }
        }
        return new Version(parts, m.group(2));
    }

    public int segment(int index) {
        return index < release.size() ? release.get(index) : 0;
    }

    public boolean isPreRelease() {
        return preRelease != null;
    }

    @Override
    public int compareTo(Version other) {
        int length = Math.max(release.size(), other.release.size());
        for (int i = 0; i < length; i++) {
            int cmp = Integer.compare(segment(i), other.segment(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        if (preRelease == null) {
            return other.preRelease == null ? 0 : 1;
        }
        if (other.preRelease == null) {
            return -1;
        }
        return comparePreRelease(preRelease, other.preRelease);
    }

    /**
     * 预发布后缀按标识符逐段比较：数字段按数值，数字段低于字母段，前缀相同时段少者更低
     */
    static int comparePreRelease(String left, String right) {
        List<String> a = identifiers(left);
        List<String> b = identifiers(right);
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            String x = a.get(i);
            String y = b.get(i);
            boolean xNumeric = isNumeric(x);
            boolean yNumeric = isNumeric(y);
            int cmp;
            if (xNumeric && yNumeric) {
                cmp = new BigInteger(x).compareTo(new BigInteger(y));
            } else if (xNumeric) {
                cmp = -1;
            } else if (yNumeric) {
                cmp = 1;
            } else {
                cmp = x.compareTo(y);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    // beta10 -> [beta, 10]；rc.2 -> [rc, 2]
    private static List<String> identifiers(String preRelease) {
        List<String> result = new ArrayList<>();
        Matcher m = IDENTIFIER.matcher(preRelease);
        while (m.find()) {
            result.add(m.group());
        }
        return result;
    }

    private static boolean isNumeric(String identifier) {
        return Character.isDigit(identifier.charAt(0));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < release.size(); i++) {
            if (i > 0) sb.append('.');
            sb.append(release.get(i));
        }
        if (preRelease != null) {
            sb.append('-').append(preRelease);
        }
        return sb.toString();
    }
}
