package ai.msf.roundtrip.pages;

import ai.msf.roundtrip.id.IdentifierService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Associates function identifiers with source-PDF page numbers for one editing session.
 *
 * <p>Page numbers live outside the MSF document. Invalid input coming from live editor state is dropped and
 * logged rather than thrown, and storage failures degrade to "no mapping available". Not thread-safe; each
 * session owns its own index.
 */
public class PageMappingIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(PageMappingIndex.class);

    static final String STORAGE_KEY_PREFIX = "pdf_page_mappings:";
    public static final int DEFAULT_PAGES_PER_FUNCTION = 3;
    private static final TypeReference<List<PageMapping>> MAPPING_LIST = new TypeReference<>() {
    };

    private final Map<String, PageMapping> mappings = new LinkedHashMap<>();
    private final KeyValueStorage storage;
    private final ObjectMapper objectMapper;
    private final int defaultPagesPerFunction;

    public PageMappingIndex(KeyValueStorage storage) {
        this(storage, new ObjectMapper(), DEFAULT_PAGES_PER_FUNCTION);
    }

    public PageMappingIndex(KeyValueStorage storage, ObjectMapper objectMapper, int defaultPagesPerFunction) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        if (defaultPagesPerFunction < 1) {
            throw new IllegalArgumentException("defaultPagesPerFunction must be at least 1");
        }
        this.defaultPagesPerFunction = defaultPagesPerFunction;
    }

    public boolean setPageMapping(String functionId, int pageNumber) {
        return setPageMapping(new PageMapping(functionId, pageNumber, null));
    }

    /**
     * Stores the mapping, replacing any previous one for the same function.
     *
     * @return {@code false} when the mapping was rejected
     */
    public boolean setPageMapping(PageMapping mapping) {
        if (mapping == null) {
            LOGGER.warn("Ignoring null page mapping");
            return false;
        }
        if (mapping.pageNumber() < 1) {
            LOGGER.warn("Invalid page number {} for function {}, must be >= 1", mapping.pageNumber(), mapping.functionId());
            return false;
        }
        if (!IdentifierService.isValid(mapping.functionId())) {
            LOGGER.warn("Invalid function identifier '{}' for page mapping", mapping.functionId());
            return false;
        }
        Double confidence = mapping.confidence();
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            LOGGER.warn("Invalid confidence {} for function {}, must be within [0, 1]", confidence, mapping.functionId());
            return false;
        }
        mappings.put(mapping.functionId(), mapping);
        return true;
    }

    public Optional<Integer> getPageMapping(String functionId) {
        if (functionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mappings.get(functionId)).map(PageMapping::pageNumber);
    }

    public void removePageMapping(String functionId) {
        if (functionId != null) {
            mappings.remove(functionId);
        }
    }

    public void clearAllPageMappings() {
        mappings.clear();
    }

    /**
     * Current mappings in insertion order.
     */
    public List<PageMapping> getAllPageMappings() {
        return List.copyOf(mappings.values());
    }

    /**
     * Replaces the current content with {@code newMappings}; invalid entries are skipped.
     */
    public void loadPageMappings(Collection<PageMapping> newMappings) {
        clearAllPageMappings();
        if (newMappings == null) {
            return;
        }
        int rejected = 0;
        for (PageMapping mapping : newMappings) {
            if (!setPageMapping(mapping)) {
                rejected++;
            }
        }
        if (rejected > 0) {
            LOGGER.warn("Skipped {} of {} page mappings while loading", rejected, newMappings.size());
        }
    }

    public int estimatePageNumber(int sequence, int totalFunctions) {
        return estimatePageNumber(sequence, totalFunctions, 0);
    }

    /**
     * Fallback page for a function without an explicit mapping. The first function maps to page 1; later ones
     * share {@code totalPages} evenly when it is known (positive), otherwise each spans the configured default.
     */
    public int estimatePageNumber(int sequence, int totalFunctions, int totalPages) {
        if (sequence <= 0) {
            return 1;
        }
        if (totalPages > 0 && totalFunctions > 0) {
            int pagesPerFunction = totalPages / totalFunctions;
            return Math.max(1, 1 + sequence * pagesPerFunction);
        }
        return 1 + sequence * defaultPagesPerFunction;
    }

    public int resolvePageNumber(String functionId, int sequence, int totalFunctions, int totalPages) {
        return getPageMapping(functionId)
                .orElseGet(() -> estimatePageNumber(sequence, totalFunctions, totalPages));
    }

    public boolean persistMappings(String documentPath) {
        return persistMappings(documentPath, getAllPageMappings());
    }

    /**
     * Writes {@code toPersist} as JSON under the document's storage key.
     *
     * @return {@code false} when nothing could be stored
     */
    public boolean persistMappings(String documentPath, List<PageMapping> toPersist) {
        if (isBlank(documentPath)) {
            LOGGER.warn("Cannot persist page mappings without a document path");
            return false;
        }
        try {
            String payload = objectMapper.writeValueAsString(toPersist == null ? List.of() : toPersist);
            storage.put(storageKey(documentPath), payload);
            LOGGER.debug("Persisted {} page mappings for {}", toPersist == null ? 0 : toPersist.size(), documentPath);
            return true;
        } catch (JsonProcessingException ex) {
            LOGGER.error("Failed to encode page mappings for {}", documentPath, ex);
            return false;
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to persist page mappings for {}", documentPath, ex);
            return false;
        }
    }

    /**
     * Reads persisted mappings for a document without loading them into this index.
     */
    public List<PageMapping> loadPersistedMappings(String documentPath) {
        if (isBlank(documentPath)) {
            LOGGER.warn("Cannot load page mappings without a document path");
            return List.of();
        }
        Optional<String> payload;
        try {
            payload = storage.get(storageKey(documentPath));
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to read persisted page mappings for {}", documentPath, ex);
            return List.of();
        }
        if (payload.isEmpty() || payload.get().isBlank()) {
            return List.of();
        }
        try {
            List<PageMapping> decoded = objectMapper.readValue(payload.get(), MAPPING_LIST);
            return decoded == null ? List.of() : new ArrayList<>(decoded);
        } catch (JsonProcessingException ex) {
            LOGGER.error("Failed to parse persisted page mappings for {}", documentPath, ex);
            return List.of();
        }
    }

    public void clearPersistedMappings(String documentPath) {
        if (isBlank(documentPath)) {
            LOGGER.warn("Cannot clear page mappings without a document path");
            return;
        }
        try {
            storage.remove(storageKey(documentPath));
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to clear persisted page mappings for {}", documentPath, ex);
        }
    }

    static String storageKey(String documentPath) {
        return STORAGE_KEY_PREFIX + documentPath;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
