package com.flowmable.seasonal;

import java.util.List;

/**
 * User-facing explanation of a rating: a summary sentence and three bullets
 * (face impact, what goes wrong or right, how to wear it).
 */
public record ColorExplanation(String summary, List<Bullet> bullets) {

    public ColorExplanation {
        bullets = List.copyOf(bullets);
    }

    /**
     * @param micronote Rendered smaller and lighter than the summary line
     */
    public record Bullet(String text, boolean micronote) {}

    static Bullet plain(String text) {
        return new Bullet(text, false);
    }

    static Bullet note(String text) {
        return new Bullet(text, true);
    }
}
