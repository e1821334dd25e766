package org.stianloader.shyresolve.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.jetbrains.annotations.NotNull;

final class MutableClock extends Clock {
    @NotNull
    private Instant now;

    MutableClock(@NotNull Instant now) {
        this.now = now;
    }

    void advance(@NotNull Duration duration) {
        this.now = this.now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Instant instant() {
        return this.now;
    }

    void set(@NotNull Instant now) {
        this.now = now;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
