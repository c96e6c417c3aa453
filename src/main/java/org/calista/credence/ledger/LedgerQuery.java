package org.calista.credence.ledger;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Filter over ledger entries. Unset fields match everything.
 */
public final class LedgerQuery {

    public enum Order {ASCENDING, DESCENDING}

    private final Set<EntryKind> kinds;
    private final Long fromEpochMs;
    private final Long toEpochMs;
    private final String correlationId;
    private final String source;
    private final String textSearch;
    private final Order order;
    private final int limit;
    private final int offset;

    private LedgerQuery(Builder b) {
        this.kinds = b.kinds.isEmpty() ? Set.of() : Set.copyOf(b.kinds);
        this.fromEpochMs = b.fromEpochMs;
        this.toEpochMs = b.toEpochMs;
        this.correlationId = b.correlationId;
        this.source = b.source;
        this.textSearch = b.textSearch == null ? null : b.textSearch.toLowerCase(Locale.ROOT);
        this.order = b.order;
        this.limit = b.limit;
        this.offset = b.offset;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static LedgerQuery all() {
        return new Builder().build();
    }

    public boolean matches(LedgerEntry e) {
        if (!kinds.isEmpty() && !kinds.contains(e.kind())) return false;
        if (fromEpochMs != null && e.timestampEpochMs() < fromEpochMs) return false;
        if (toEpochMs != null && e.timestampEpochMs() > toEpochMs) return false;
        if (correlationId != null && !correlationId.equals(e.correlationId())) return false;
        if (source != null && !source.equals(e.provenance().source())) return false;
        if (textSearch != null) {
            String hay = e.payload().toString().toLowerCase(Locale.ROOT);
            if (!hay.contains(textSearch)) return false;
        }
        return true;
    }

    public Order order() {
        return order;
    }

    public int limit() {
        return limit;
    }

    public int offset() {
        return offset;
    }

    public static final class Builder {
        private final EnumSet<EntryKind> kinds = EnumSet.noneOf(EntryKind.class);
        private Long fromEpochMs;
        private Long toEpochMs;
        private String correlationId;
        private String source;
        private String textSearch;
        private Order order = Order.ASCENDING;
        private int limit = Integer.MAX_VALUE;
        private int offset = 0;

        public Builder kinds(EntryKind... ks) {
            for (EntryKind k : ks) kinds.add(Objects.requireNonNull(k, "kind"));
            return this;
        }

        /** Inclusive range on the entry timestamp. */
        public Builder timeRange(long fromEpochMs, long toEpochMs) {
            if (fromEpochMs > toEpochMs) throw new IllegalArgumentException("from > to");
            this.fromEpochMs = fromEpochMs;
            this.toEpochMs = toEpochMs;
            return this;
        }

        public Builder correlationId(String id) {
            this.correlationId = id;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        /** Case-insensitive substring over the payload JSON. */
        public Builder textSearch(String text) {
            this.textSearch = (text == null || text.isBlank()) ? null : text;
            return this;
        }

        public Builder order(Order order) {
            this.order = Objects.requireNonNull(order, "order");
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
            this.offset = offset;
            return this;
        }

        public LedgerQuery build() {
            return new LedgerQuery(this);
        }
    }
}
