package com.zplat.ipld.service;

import com.univocity.parsers.csv.CsvParser;
import com.zplat.ipld.entity.*;
import com.zplat.ipld.entity.enumeration.IplBucket;
import com.zplat.ipld.exception.AppException;
import com.zplat.ipld.exception.ErrorCode;
import com.zplat.ipld.repository.*;
import com.zplat.ipld.utils.IplCsvParserFactory;
import com.zplat.ipld.utils.IplTimestamps;
import com.zplat.ipld.utils.RowKeys;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads new result CSVs into {@code raw_results} and classifies the raw rows of the
 * affected systems into the done/fail/garbage tables plus the last-IPL index.
 * Every table is append-only; nothing already stored is inserted twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class IngestionClassifierService {

    static final String COL_SYSNAME = "sysname";
    static final String COL_LOG_DATASET = "log_dataset";
    static final String COL_SHUTDOWN_BEGIN = "shutdown_begin";
    static final String COL_SHUTDOWN_END = "shutdown_end";
    static final String COL_IPL_BEGIN = "ipl_begin";
    static final String COL_IPL_END = "ipl_end";
    static final String COL_PRE_IPL = "pre_ipl";
    static final String COL_POST_IPL = "post_ipl";
    static final String COL_POS_IPL = "pos_ipl";
    static final String COL_LAST_IPL = "last_ipl";

    RawResultRepository rawResultRepository;
    ResultDoneRepository resultDoneRepository;
    ResultFailRepository resultFailRepository;
    ResultGarbageRepository resultGarbageRepository;
    ResultLastIplRepository resultLastIplRepository;
    IplCsvParserFactory csvParserFactory;
    Clock clock;

    @NonFinal
    @Value("${ipld.results-root:results}")
    String resultsRoot;

    @NonFinal
    @Value("${ipld.ingest.file-marker:resume}")
    String fileMarker;

    @NonFinal
    @Value("${ipld.ingest.min-file-size:205}")
    long minFileSize;

    @NonFinal
    @Value("${ipld.ingest.first-load-min-file-size:800}")
    long firstLoadMinFileSize;

    /**
     * Ingests every new result file under the results root, then classifies the rows of the
     * systems those files touched.
     *
     * @return names of the systems that received new raw rows
     */
    @Transactional
    public Set<String> ingestAndClassify() {
        Set<String> touched = ingestRaw();
        if (touched.isEmpty()) {
            log.info("No new IPL data to ingest under {}", resultsRoot);
            return touched;
        }
        classify(touched);
        return touched;
    }

    Set<String> ingestRaw() {
        Map<String, Path> files = discover(Paths.get(resultsRoot));
        boolean firstLoad = rawResultRepository.count() == 0;
        long threshold = firstLoad ? firstLoadMinFileSize : minFileSize;
        Set<String> knownDatasets = new HashSet<>(rawResultRepository.findDistinctLogDatasets());
        Set<String> touched = new TreeSet<>();

        for (Map.Entry<String, Path> file : files.entrySet()) {
            Path path = file.getValue();
            long size = sizeOf(path);
            if (size <= threshold) {
                log.debug("Skipping {} ({} bytes, threshold {})", file.getKey(), size, threshold);
                continue;
            }

            List<RawResult> rows = parse(path);
            Set<String> datasets = rows.stream()
                    .map(RawResult::getLogDataset)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            Set<String> fresh = new LinkedHashSet<>(datasets);
            fresh.removeAll(knownDatasets);
            if (datasets.isEmpty() && !rows.isEmpty()) {
                // no dataset to key on: load the file once, by name
                if (rawResultRepository.existsBySourceFile(file.getKey())) {
                    log.debug("Skipping {}: already ingested without a log dataset", file.getKey());
                    continue;
                }
            } else if (fresh.isEmpty()) {
                log.debug("Skipping {}: datasets already ingested", file.getKey());
                continue;
            }

            rawResultRepository.saveAll(rows);
            knownDatasets.addAll(datasets);
            Set<String> sysnames = rows.stream()
                    .map(RawResult::getSysname)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(TreeSet::new));
            touched.addAll(sysnames);
            log.info("The {} / {} was successfully ingested ({} rows from {})",
                    fresh, sysnames, rows.size(), file.getKey());
        }
        return touched;
    }

    /** Recursive scan for {@code *.CSV} files carrying the marker; one entry per distinct file name. */
    Map<String, Path> discover(Path root) {
        Map<String, Path> found = new TreeMap<>();
        if (!Files.isDirectory(root)) {
            log.warn("Results root {} does not exist", root.toAbsolutePath());
            return found;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.filter(Files::isRegularFile)
                    .forEach(p -> {
                        String name = p.getFileName().toString();
                        if (name.endsWith(".CSV") && name.contains(fileMarker)) {
                            found.put(name, p);
                        }
                    });
        } catch (IOException e) {
            throw new AppException(ErrorCode.INGEST_READ_ERROR, root.toString(), e);
        }
        return found;
    }

    List<RawResult> parse(Path path) {
        CsvParser parser = csvParserFactory.newParser();
        LocalDateTime now = LocalDateTime.now(clock);
        List<RawResult> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            parser.beginParsing(reader);
            String[] header = parser.parseNext();
            if (header == null) return rows;
            Map<String, Integer> index = new HashMap<>();
            for (int i = 0; i < header.length; i++) {
                if (header[i] != null) index.put(header[i].trim().toLowerCase(Locale.ROOT), i);
            }
            // the driver writes post_ipl; older result files used pos_ipl
            String postIplColumn = index.containsKey(COL_POST_IPL) ? COL_POST_IPL : COL_POS_IPL;

            String[] line;
            while ((line = parser.parseNext()) != null) {
                rows.add(RawResult.builder()
                        .sysname(column(line, index, COL_SYSNAME, RawResult.SYSNAME_LENGTH))
                        .logDataset(column(line, index, COL_LOG_DATASET, RawResult.VALUE_LENGTH))
                        .shutdownBegin(column(line, index, COL_SHUTDOWN_BEGIN, RawResult.VALUE_LENGTH))
                        .shutdownEnd(column(line, index, COL_SHUTDOWN_END, RawResult.VALUE_LENGTH))
                        .iplBegin(column(line, index, COL_IPL_BEGIN, RawResult.VALUE_LENGTH))
                        .iplEnd(column(line, index, COL_IPL_END, RawResult.VALUE_LENGTH))
                        .preIpl(column(line, index, COL_PRE_IPL, RawResult.MESSAGE_LENGTH))
                        .posIpl(column(line, index, postIplColumn, RawResult.MESSAGE_LENGTH))
                        .lastIpl(column(line, index, COL_LAST_IPL, RawResult.VALUE_LENGTH))
                        .sourceFile(path.getFileName().toString())
                        .ingestedAt(now)
                        .build());
            }
        } catch (IOException e) {
            throw new AppException(ErrorCode.INGEST_READ_ERROR, path.toString(), e);
        } finally {
            parser.stopParsing();
        }
        return rows;
    }

    /**
     * Classifies the raw rows of {@code sysnames} and appends rows not already stored.
     */
    void classify(Collection<String> sysnames) {
        List<ResultDone> done = new ArrayList<>();
        List<ResultFail> fail = new ArrayList<>();
        List<ResultGarbage> garbage = new ArrayList<>();
        List<ResultLastIpl> lastIpl = new ArrayList<>();
        Set<String> batchKeys = new HashSet<>();
        Set<String> batchLastIpl = new HashSet<>();

        for (RawResult raw : rawResultRepository.findBySysnameInOrderByIdAsc(sysnames)) {
            String key = RowKeys.of(raw.getSysname(), raw.getLogDataset(),
                    raw.getShutdownBegin(), raw.getShutdownEnd(), raw.getIplBegin(), raw.getIplEnd(),
                    raw.getPreIpl(), raw.getPosIpl());

            switch (bucketOf(raw)) {
                case DONE -> {
                    if (batchKeys.add("D" + key) && !resultDoneRepository.existsByRowKey(key)) {
                        done.add(toDone(raw, key));
                    }
                }
                case FAIL -> {
                    if (batchKeys.add("F" + key) && !resultFailRepository.existsByRowKey(key)) {
                        fail.add(ResultFail.builder()
                                .sysname(raw.getSysname())
                                .logDataset(raw.getLogDataset())
                                .shutdownBegin(raw.getShutdownBegin())
                                .shutdownEnd(raw.getShutdownEnd())
                                .iplBegin(raw.getIplBegin())
                                .iplEnd(raw.getIplEnd())
                                .preIpl(raw.getPreIpl())
                                .posIpl(raw.getPosIpl())
                                .rowKey(key)
                                .build());
                    }
                }
                case GARBAGE -> {
                    if (batchKeys.add("G" + key) && !resultGarbageRepository.existsByRowKey(key)) {
                        garbage.add(ResultGarbage.builder()
                                .sysname(raw.getSysname())
                                .logDataset(raw.getLogDataset())
                                .shutdownBegin(raw.getShutdownBegin())
                                .shutdownEnd(raw.getShutdownEnd())
                                .iplBegin(raw.getIplBegin())
                                .iplEnd(raw.getIplEnd())
                                .preIpl(raw.getPreIpl())
                                .posIpl(raw.getPosIpl())
                                .rowKey(key)
                                .build());
                    }
                }
            }

            if (IplTimestamps.isValid(raw.getLastIpl())
                    && batchLastIpl.add(raw.getSysname() + '\u001F' + raw.getLastIpl())
                    && !resultLastIplRepository.existsBySysnameAndLastIpl(raw.getSysname(), raw.getLastIpl())) {
                lastIpl.add(ResultLastIpl.builder()
                        .sysname(raw.getSysname())
                        .logDataset(raw.getLogDataset())
                        .lastIpl(raw.getLastIpl())
                        .build());
            }
        }

        resultDoneRepository.saveAll(done);
        resultFailRepository.saveAll(fail);
        resultGarbageRepository.saveAll(garbage);
        resultLastIplRepository.saveAll(lastIpl);
        log.info("Classified {}: {} done, {} fail, {} garbage, {} last ipl",
                sysnames, done.size(), fail.size(), garbage.size(), lastIpl.size());
    }

    /**
     * DONE when all four core timestamps parse, FAIL when at least one is present,
     * GARBAGE otherwise. Malformed values never raise.
     */
    public static IplBucket bucketOf(RawResult raw) {
        String[] core = {raw.getShutdownBegin(), raw.getShutdownEnd(), raw.getIplBegin(), raw.getIplEnd()};
        if (Arrays.stream(core).allMatch(IplTimestamps::isValid)) {
            return IplBucket.DONE;
        }
        if (Arrays.stream(core).anyMatch(IplTimestamps::isPresent)) {
            return IplBucket.FAIL;
        }
        return IplBucket.GARBAGE;
    }

    static ResultDone toDone(RawResult raw, String key) {
        return ResultDone.builder()
                .sysname(raw.getSysname())
                .iplDate(IplTimestamps.toIplDate(raw.getShutdownBegin()))
                .logDataset(raw.getLogDataset())
                .shutdownBegin(raw.getShutdownBegin())
                .shutdownEnd(raw.getShutdownEnd())
                .iplBegin(raw.getIplBegin())
                .iplEnd(raw.getIplEnd())
                .preIpl(raw.getPreIpl())
                .posIpl(raw.getPosIpl())
                .shutdownDuration(IplTimestamps.between(raw.getShutdownBegin(), raw.getShutdownEnd()))
                .poweroffDuration(IplTimestamps.between(raw.getShutdownEnd(), raw.getIplBegin()))
                .loadIpl(IplTimestamps.between(raw.getIplBegin(), raw.getIplEnd()))
                .totalDuration(IplTimestamps.between(raw.getShutdownBegin(), raw.getIplEnd()))
                .rowKey(key)
                .build();
    }

    /** Blank cells become null; values longer than the column are cut to fit it. */
    static String column(String[] line, Map<String, Integer> index, String name, int maxLength) {
        Integer i = index.get(name);
        if (i == null || i >= line.length) return null;
        String value = line[i];
        if (value == null || value.isBlank()) return null;
        if (value.length() > maxLength) {
            log.debug("Column {} truncated from {} to {} characters", name, value.length(), maxLength);
            return value.substring(0, maxLength);
        }
        return value;
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new AppException(ErrorCode.INGEST_READ_ERROR, path.toString(), e);
        }
    }
}
