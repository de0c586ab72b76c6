package com.darksite.metering.adapters;

import com.darksite.metering.domain.model.ResourceKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Base for adapters whose list endpoints page through results.
 *
 * Pages are exposed as a lazy, restartable sequence: every iteration starts
 * from the first page and requests the next one only when asked, using the
 * cursor the previous page returned. {@link #fetch} drains the sequence and
 * hands each page's records to the sink once the whole page is parsed.
 */
@Slf4j
public abstract class PaginatedEndpointAdapter implements EndpointAdapter {

    protected final PrismHttpClient client;
    protected final Clock clock;

    protected PaginatedEndpointAdapter(PrismHttpClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    @Override
    public void fetch(ResourceKind kind, RecordSink sink) {
        if (!getSupportedKinds().contains(kind)) {
            throw new IllegalArgumentException(getGeneration() + " adapter cannot fetch " + kind);
        }

        int pageCount = 0;
        int entityCount = 0;
        for (Page page : pages(kind)) {
            Instant observedAt = clock.instant();
            var buffer = new PageBuffer(sink);
            for (JsonNode entity : page.entities()) {
                extract(kind, entity, observedAt, buffer);
            }
            buffer.flush();
            pageCount++;
            entityCount += page.entities().size();
        }
        log.debug("Drained {} {} entities from {} page(s) of {}", entityCount, kind, pageCount, getGeneration());
    }

    /**
     * Lazy page sequence for a kind; each iterator starts from the first page.
     */
    public Iterable<Page> pages(ResourceKind kind) {
        return () -> new PageIterator(kind);
    }

    /**
     * Cursor of the first page.
     */
    protected abstract PageCursor firstPage(ResourceKind kind);

    /**
     * Request one page.
     *
     * @throws MeteringException when the page cannot be obtained
     */
    protected abstract Page fetchPage(ResourceKind kind, PageCursor cursor);

    /**
     * Turn one wire entity into adapter records.
     */
    protected abstract void extract(ResourceKind kind, JsonNode entity, Instant observedAt, RecordSink sink);

    /**
     * Reads the entity array of a response, rejecting responses without one.
     */
    protected static List<JsonNode> requireArray(JsonNode response, String field, String endpoint) {
        JsonNode array = response.path(field);
        if (!array.isArray()) {
            throw new MeteringException(ErrorCategory.PERMANENT,
                    "Response from " + endpoint + " has no '" + field + "' array");
        }
        var entities = new ArrayList<JsonNode>(array.size());
        array.forEach(entities::add);
        return entities;
    }

    /**
     * Text of a field, null when absent or blank.
     */
    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * Raw scalar: a Number for numeric nodes, a String for textual ones, null otherwise.
     */
    protected static Object scalar(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        return node.isValueNode() ? node.asText() : null;
    }

    /**
     * Position in a paged listing.
     *
     * @param index   page number or offset, in the generation's own convention
     * @param fetched entities received before this page
     */
    public record PageCursor(int index, int fetched) {}

    /**
     * One page of wire entities and the cursor of the following page, if any.
     */
    public record Page(List<JsonNode> entities, PageCursor next) {

        public boolean hasNext() {
            return next != null;
        }

        /**
         * Builds a page whose successor exists while fewer than {@code total} entities were seen.
         * A missing total falls back to "a full page means there may be more".
         */
        public static Page of(List<JsonNode> entities, PageCursor current, PageCursor following,
                              int total, int pageSize) {
            int seen = current.fetched() + entities.size();
            boolean more = !entities.isEmpty() && (total >= 0 ? seen < total : entities.size() >= pageSize);
            return new Page(entities, more ? following : null);
        }
    }

    private final class PageIterator implements Iterator<Page> {

        private final ResourceKind kind;
        private PageCursor cursor;

        private PageIterator(ResourceKind kind) {
            this.kind = kind;
            this.cursor = firstPage(kind);
        }

        @Override
        public boolean hasNext() {
            return cursor != null;
        }

        @Override
        public Page next() {
            if (cursor == null) {
                throw new NoSuchElementException();
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new MeteringException(ErrorCategory.TRANSIENT,
                        "Interrupted before page " + cursor.index() + " of " + kind);
            }
            Page page = fetchPage(kind, cursor);
            cursor = page.next();
            return page;
        }
    }

    /**
     * Holds a page's records until the page is fully parsed.
     */
    private static final class PageBuffer implements RecordSink {

        private final RecordSink target;
        private final List<AdapterRecord> records = new ArrayList<>();

        private PageBuffer(RecordSink target) {
            this.target = target;
        }

        @Override
        public void accept(AdapterRecord record) {
            records.add(record);
        }

        @Override
        public void markIncomplete(MeteringException reason) {
            target.markIncomplete(reason);
        }

        void flush() {
            target.acceptAll(List.copyOf(records));
        }
    }
}
