package eu.virtualparadox.docrag.application;

import eu.virtualparadox.docrag.ingest.IngestionPipeline;
import eu.virtualparadox.docrag.ingest.IngestionReport;
import eu.virtualparadox.docrag.query.QueryAnswer;
import eu.virtualparadox.docrag.query.QueryManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry: {@code --ingest=<file>} runs an ingestion, {@code --ask=<question>} answers
 * a question against the index. Ingestions run before questions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocRagRunner implements ApplicationRunner {

    private static final String OPTION_INGEST = "ingest";
    private static final String OPTION_ASK = "ask";

    private final IngestionPipeline ingestionPipeline;
    private final QueryManager queryManager;

    @Override
    public void run(final ApplicationArguments args) {
        for (final String source : optionValues(args, OPTION_INGEST)) {
            final IngestionReport report = ingestionPipeline.ingest(Path.of(source));
            log.info("Ingested {} as run {} ({} segments)", source, report.runId(), report.segments());
        }

        for (final String question : optionValues(args, OPTION_ASK)) {
            final QueryAnswer answer = queryManager.ask(question);
            log.info("Q: {}\nA: {}", answer.question(), answer.answer());
        }
    }

    private static List<String> optionValues(final ApplicationArguments args, final String option) {
        final List<String> values = args.getOptionValues(option);
        return values == null ? List.of() : values;
    }
}
