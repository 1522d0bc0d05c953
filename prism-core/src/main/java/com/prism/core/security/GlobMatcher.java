package com.prism.core.security;

import com.prism.api.exception.ConfigurationException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * shell 风格通配符匹配（* ? [seq] [!seq]），* 可跨越 '/'
 * <p>
 * 字符集内除区间连字符外一律按字面量处理，未闭合的 '[' 视为普通字符。
 * </p>
 */
public final class GlobMatcher {

    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private GlobMatcher() {
    }

    public static boolean matches(String text, String glob) {
        if (text == null || glob == null) {
            return false;
        }
        return CACHE.computeIfAbsent(glob, GlobMatcher::compile).matcher(text).matches();
    }

    /**
     * 注册能力定义时提前校验
     *
     * @throws ConfigurationException 通配符无法编译
     */
    public static void validate(String glob) {
        if (glob != null) {
            CACHE.computeIfAbsent(glob, GlobMatcher::compile);
        }
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    int j = i;
                    if (j < n && glob.charAt(j) == '!') {
                        j++;
                    }
                    if (j < n && glob.charAt(j) == ']') {
                        j++;
                    }
                    while (j < n && glob.charAt(j) != ']') {
                        j++;
                    }
                    if (j >= n) {
                        regex.append("\\[");
                    } else {
                        regex.append(characterClass(glob.substring(i, j)));
                        i = j + 1;
                    }
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        try {
            return Pattern.compile(regex.toString(), Pattern.DOTALL);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Malformed glob pattern '" + glob + "': " + e.getDescription(), e);
        }
    }

    private static String characterClass(String body) {
        StringBuilder out = new StringBuilder("[");
        int start = 0;
        if (body.startsWith("!")) {
            out.append('^');
            start = 1;
        }
        for (int k = start; k < body.length(); k++) {
            char ch = body.charAt(k);
            boolean range = ch == '-' && k > start && k < body.length() - 1;
            if (!range && !Character.isLetterOrDigit(ch)) {
                out.append('\\');
            }
            out.append(ch);
        }
        return out.append(']').toString();
    }
}
