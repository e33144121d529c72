package com.mindcanvus.domain.model;

/**
 * Outcome of one scheduled-publisher tick.
 *
 * @param due       posts whose scheduled time had arrived
 * @param published posts promoted during this tick
 * @param failed    posts whose update threw; they stay scheduled for the next tick
 */
public record PublishReport(int due, int published, int failed) {

    public static final PublishReport NOTHING_DUE = new PublishReport(0, 0, 0);
}
