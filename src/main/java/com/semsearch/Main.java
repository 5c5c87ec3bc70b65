package com.semsearch;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.semsearch.embedding.EmbeddingModel;
import com.semsearch.embedding.EmbeddingModelRegistry;
import com.semsearch.embedding.EmbeddingServices;
import com.semsearch.error.ErrorKind;
import com.semsearch.error.SemanticSearchException;
import com.semsearch.index.BuildReport;
import com.semsearch.index.IndexBackend;
import com.semsearch.index.IndexId;
import com.semsearch.index.IndexMetadata;
import com.semsearch.index.IndexRegistry;
import com.semsearch.ingest.Chunker;
import com.semsearch.ingest.Document;
import com.semsearch.ingest.DocumentStore;
import com.semsearch.ingest.FileSystemDocumentStore;
import com.semsearch.query.QueryEngine;
import com.semsearch.query.QueryOutcome;
import com.semsearch.query.RankedResult;
import com.semsearch.runtime.AppConfig;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "semantic-search",
        mixinStandardHelpOptions = true,
        version = "semantic-search 0.1.0",
        description = "Builds vector indices over text documents and answers semantic queries against them.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_INDEX_NOT_FOUND = 3;

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "list")
    Mode mode;

    @Option(names = "--data-dir", description = "Directory holding the .txt/.md documents (overrides storage.dataDir)")
    Path dataDir;

    @Option(names = "--index-dir", description = "Directory holding persisted indices (overrides storage.indexDir)")
    Path indexDir;

    @Option(names = "--model", description = "Embedding model id or short name for build mode")
    String model;

    @Option(names = "--backend", description = "Index backend for build mode: exact, local-json")
    String backend;

    @Option(names = "--index", description = "Index id, e.g. local-json_all-MiniLM-L6-v2")
    String indexId;

    @Option(names = "--text", description = "Query text; repeat for batch mode")
    List<String> texts = new ArrayList<>();

    @Option(names = "--top-k", description = "Results to return per query (defaults to query.defaultTopK)")
    Integer topK;

    @Option(names = "--timeout-ms", description = "Single-query timeout in ms (defaults to query.timeoutMs, 0 disables)")
    Integer timeoutMs;

    private final OkHttpClient httpClient = new OkHttpClient();
    private final ObjectMapper jsonMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    enum Mode {
        models,
        documents,
        list,
        build,
        query,
        batch,
        remove
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        Path documentsDir = dataDir != null ? dataDir : Path.of(config.getStorage().getDataDir());
        Path indicesDir = indexDir != null ? indexDir : Path.of(config.getStorage().getIndexDir());

        log.info("Starting semantic-search in {} mode", mode);
        log.info("Using config file: {} dataDir={} indexDir={}", configPath, documentsDir, indicesDir);

        try {
            Chunker chunker = new Chunker(config.getChunking().getChunkSize(), config.getChunking().getOverlap());
            DocumentStore documentStore = new FileSystemDocumentStore(documentsDir);
            EmbeddingModelRegistry models = EmbeddingServices.fromConfig(config.getEmbedding(), httpClient);
            IndexRegistry registry = new IndexRegistry(documentStore, models, chunker, indicesDir);
            try (QueryEngine engine = new QueryEngine(registry, models, config.getQuery().getWorkerThreads())) {
                return run(config, documentStore, registry, engine);
            }
        } catch (SemanticSearchException e) {
            if (e.kind() == ErrorKind.DIMENSION_MISMATCH || e.kind() == ErrorKind.BACKEND_IO) {
                log.error("{} failed: {}", mode, e.getMessage(), e);
            } else {
                log.error("{} failed: {}", mode, e.getMessage());
            }
            spec.commandLine().getErr().println(e.kind() + ": " + e.getMessage());
            return exitCodeFor(e.kind());
        }
    }

    private int run(AppConfig config, DocumentStore documentStore, IndexRegistry registry, QueryEngine engine)
            throws JsonProcessingException {
        int k = topK != null ? topK : config.getQuery().getDefaultTopK();
        switch (mode) {
            case models -> print(supportedVariants());
            case documents -> print(documentSummaries(documentStore.listDocuments()));
            case list -> {
                List<IndexMetadata> indices = registry.list();
                log.info("Found {} indices", indices.size());
                print(indices);
            }
            case build -> {
                String modelId = model != null ? model : config.getEmbedding().getDefaultModel();
                String backendId = backend != null ? backend : config.getIndex().getDefaultBackend();
                BuildReport report = registry.build(modelId, backendId);
                log.info("Built index {}: documents={} chunks={} dimension={}",
                        report.indexId(), report.documentsProcessed(), report.chunksCreated(), report.dimension());
                print(report);
            }
            case query -> {
                if (texts.size() != 1) {
                    return usageError("query mode needs exactly one --text");
                }
                String target = requireIndex();
                if (target == null) {
                    return EXIT_USAGE_ERROR;
                }
                int timeout = timeoutMs != null ? timeoutMs : config.getQuery().getTimeoutMs();
                List<RankedResult> results = timeout > 0
                        ? engine.query(texts.get(0), target, k, Duration.ofMillis(timeout))
                        : engine.query(texts.get(0), target, k);
                for (RankedResult result : results) {
                    log.info("Result #{} score={} source={}", result.rank(),
                            String.format(Locale.ROOT, "%.4f", result.similarityScore()), result.sourceDocument());
                }
                print(results);
            }
            case batch -> {
                if (texts.isEmpty()) {
                    return usageError("batch mode needs at least one --text");
                }
                String target = requireIndex();
                if (target == null) {
                    return EXIT_USAGE_ERROR;
                }
                List<QueryOutcome> outcomes = engine.batchQuery(texts, target, k);
                print(outcomes);
            }
            case remove -> {
                String target = requireIndex();
                if (target == null) {
                    return EXIT_USAGE_ERROR;
                }
                IndexId id = IndexId.parse(target);
                if (!registry.remove(id)) {
                    throw SemanticSearchException.indexNotFound(id.value());
                }
                print(Map.of("removed", id.value()));
            }
        }
        return EXIT_OK;
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            log.debug("Config file {} not found; using defaults", config);
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private String requireIndex() {
        if (indexId == null || indexId.isBlank()) {
            usageError("--index is required in " + mode + " mode");
            return null;
        }
        return indexId;
    }

    private int usageError(String message) {
        log.error(message);
        spec.commandLine().getErr().println(message);
        return EXIT_USAGE_ERROR;
    }

    private void print(Object value) throws JsonProcessingException {
        PrintWriter out = spec.commandLine().getOut();
        out.println(jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        out.flush();
    }

    static int exitCodeFor(ErrorKind kind) {
        if (kind == ErrorKind.INDEX_NOT_FOUND) {
            return EXIT_INDEX_NOT_FOUND;
        }
        return kind.isUserError() ? EXIT_USAGE_ERROR : EXIT_FAILURE;
    }

    private static Map<String, Object> supportedVariants() {
        List<Map<String, Object>> modelRows = new ArrayList<>();
        for (EmbeddingModel embeddingModel : EmbeddingModel.values()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("model_id", embeddingModel.id());
            row.put("short_name", embeddingModel.shortName());
            row.put("dimension", embeddingModel.dimension());
            modelRows.add(row);
        }
        List<Map<String, Object>> backendRows = new ArrayList<>();
        for (IndexBackend indexBackend : IndexBackend.values()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("backend_id", indexBackend.id());
            row.put("persistent", indexBackend.persistent());
            backendRows.add(row);
        }
        Map<String, Object> variants = new LinkedHashMap<>();
        variants.put("models", modelRows);
        variants.put("backends", backendRows);
        return variants;
    }

    private static List<Map<String, Object>> documentSummaries(List<Document> documents) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Document document : documents) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", document.id());
            row.put("size_bytes", document.sizeBytes());
            rows.add(row);
        }
        return rows;
    }
}
