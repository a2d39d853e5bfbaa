package com.soundbank.generator.codegen.writer;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.soundbank.generator.codegen.model.core.context.GenerationFlags;
import com.soundbank.generator.codegen.model.core.context.GenerationStats;
import com.soundbank.generator.codegen.model.output.Artifact;
import com.soundbank.generator.codegen.model.output.ArtifactSink;
import com.soundbank.generator.codegen.util.FileWriteUtil;
import com.soundbank.generator.codegen.util.NamingUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Sink that renders artifacts through a FreeMarker template into {@code <name>.txtp} files.
 *
 * Empty artifacts are dropped. An artifact whose structure was already seen is a duplicate
 * and dropped too, unless duplicates are requested. Suppressed artifacts still count as seen,
 * so a suppressed regular pass keeps the unused pass from repeating its output.
 */
public class TemplateArtifactWriter implements ArtifactSink {
    private static final Logger log = LoggerFactory.getLogger(TemplateArtifactWriter.class);

    public static final String EXTENSION = ".txtp";
    private static final String TEMPLATE = "artifact.ftl";

    private final Path outputDir;
    private final GenerationFlags flags;
    private final Configuration freemarkerConfig;

    private final Set<String> signatures = new HashSet<>();
    private final Set<String> usedNames = new HashSet<>();

    private int written;
    private int unusedWritten;
    private int duplicates;
    private int empty;
    private int suppressed;

    public TemplateArtifactWriter(Path outputDir, GenerationFlags flags) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.flags = Objects.requireNonNull(flags, "flags");
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    @Override
    public void publish(Artifact artifact) {
        String displayName = artifact.getDisplayName();

        if (artifact.isEmpty()) {
            log.debug("Skipped empty artifact {}", displayName);
            empty++;
            return;
        }

        if (!flags.isDupes()) {
            String signature = ArtifactSignatureCalculator.calculateSignature(artifact);
            if (!signatures.add(signature)) {
                log.debug("Skipped duplicate artifact {}", displayName);
                duplicates++;
                return;
            }
        }

        if (artifact.isSuppressed()) {
            suppressed++;
            return;
        }

        String name = NamingUtil.disambiguate(NamingUtil.toFileName(displayName), usedNames);
        String text = renderText(artifact, displayName);

        if (!flags.isDryRun()) {
            Path file = outputDir.resolve(name + EXTENSION);
            try {
                FileWriteUtil.safeWriteString(file, text);
            } catch (IOException e) {
                throw new ArtifactWriteException("Failed to write " + file, e);
            }
        }
        log.debug("Wrote {}{}", name, EXTENSION);

        if (artifact.isUnused()) {
            unusedWritten++;
        } else {
            written++;
        }
    }

    String renderText(Artifact artifact, String displayName) {
        Map<String, Object> model = new HashMap<>();
        model.put("lines", artifact.getLines());
        model.put("infos", artifact.getInfos());
        model.put("name", displayName);
        model.put("unused", artifact.isUnused());
        if (artifact.getCaller() != null) {
            model.put("caller", artifact.getCaller().toString());
        }

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ArtifactWriteException("Failed to render artifact " + displayName, e);
        }
    }

    public GenerationStats getStats() {
        return GenerationStats.builder()
                .written(written)
                .unusedWritten(unusedWritten)
                .duplicates(duplicates)
                .empty(empty)
                .suppressed(suppressed)
                .build();
    }
}
