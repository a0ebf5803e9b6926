package com.hooklight.core.keywords;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Classifies subagent work by scanning task text, transcript-derived text and the agent type
 * for known technology keywords.
 * <p>
 * Every hit contributes the keyword itself plus a {@code category:<name>} meta keyword.
 * The agent type always contributes {@code agent:<role>}, e.g. {@code plugin:backend-engineer}
 * becomes {@code agent:backend engineer}.
 */
public final class KeywordExtractor {

    public static final String CATEGORY_PREFIX = "category:";
    public static final String AGENT_PREFIX = "agent:";

    private record KeywordPattern(String keyword, Pattern pattern) {}

    private static final Map<String, List<KeywordPattern>> PATTERNS = compile(categories());

    private KeywordExtractor() {} // utility class

    /**
     * Extracts keywords from the given inputs. Any argument may be null.
     *
     * @return sorted, duplicate-free keywords; empty when all inputs are blank
     */
    public static List<String> extract(String taskDescription, String transcriptText, String agentType) {
        String searchText = String.join(" ",
                nullToEmpty(taskDescription), nullToEmpty(transcriptText), nullToEmpty(agentType))
                .toLowerCase(Locale.ROOT);

        var keywords = new TreeSet<String>();
        if (!searchText.isBlank()) {
            for (var category : PATTERNS.entrySet()) {
                for (var kp : category.getValue()) {
                    if (kp.pattern().matcher(searchText).find()) {
                        keywords.add(kp.keyword());
                        keywords.add(CATEGORY_PREFIX + category.getKey());
                    }
                }
            }
        }
        if (agentType != null && !agentType.isBlank()) {
            keywords.add(AGENT_PREFIX + normalizeAgentType(agentType));
        }
        return new ArrayList<>(keywords);
    }

    /**
     * Drops any namespace prefix (everything up to the last {@code ':'}) and turns
     * {@code '-'} and {@code '_'} into spaces.
     */
    public static String normalizeAgentType(String agentType) {
        String role = agentType.substring(agentType.lastIndexOf(':') + 1);
        return role.replace('-', ' ').replace('_', ' ').trim();
    }

    /**
     * Keyword table in category order.
     */
    public static Map<String, List<String>> categories() {
        var map = new LinkedHashMap<String, List<String>>();
        map.put("frameworks", List.of("react", "next", "nextjs", "vue", "angular", "svelte", "remix", "astro",
                "express", "fastify", "hono", "koa", "nest", "nestjs", "django", "flask", "fastapi", "rails",
                "laravel", "spring", "springboot"));
        map.put("databases", List.of("postgres", "postgresql", "mysql", "mariadb", "sqlite", "mongodb", "mongo",
                "redis", "dynamodb", "supabase", "planetscale", "turso", "neon", "prisma", "drizzle", "kysely",
                "typeorm", "sequelize"));
        map.put("auth", List.of("auth", "authentication", "authorization", "oauth", "jwt", "session", "clerk",
                "auth0", "nextauth", "lucia", "passport", "login", "signup", "password", "token"));
        map.put("testing", List.of("test", "testing", "jest", "vitest", "mocha", "chai", "playwright", "cypress",
                "puppeteer", "unit test", "integration test", "e2e", "coverage"));
        map.put("api", List.of("api", "rest", "graphql", "trpc", "grpc", "endpoint", "route", "handler",
                "middleware", "openapi", "swagger", "apollo"));
        map.put("devops", List.of("docker", "kubernetes", "k8s", "terraform", "ansible", "ci", "cd", "pipeline",
                "deploy", "deployment", "aws", "gcp", "azure", "vercel", "netlify", "railway", "github actions",
                "gitlab ci"));
        map.put("frontend", List.of("css", "tailwind", "styled-components", "sass", "scss", "component", "ui", "ux",
                "responsive", "animation", "form", "modal", "table", "button", "input"));
        map.put("state", List.of("state", "redux", "zustand", "jotai", "recoil", "mobx", "context", "provider",
                "store"));
        map.put("typescript", List.of("typescript", "type", "interface", "generic", "enum", "zod", "yup", "io-ts",
                "validation", "schema"));
        map.put("performance", List.of("performance", "optimization", "cache", "caching", "lazy", "bundle",
                "minify", "compress", "speed"));
        map.put("security", List.of("security", "xss", "csrf", "sql injection", "sanitize", "encrypt", "hash",
                "ssl", "https", "cors"));
        map.put("files", List.of("file", "upload", "download", "stream", "buffer", "read", "write", "create",
                "delete", "modify"));
        return map;
    }

    private static Map<String, List<KeywordPattern>> compile(Map<String, List<String>> categories) {
        var compiled = new LinkedHashMap<String, List<KeywordPattern>>();
        categories.forEach((category, keywords) -> compiled.put(category, keywords.stream()
                .map(k -> new KeywordPattern(k, Pattern.compile("\\b" + Pattern.quote(k) + "\\b")))
                .toList()));
        return compiled;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
