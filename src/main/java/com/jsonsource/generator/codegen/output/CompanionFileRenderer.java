package com.jsonsource.generator.codegen.output;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonsource.generator.codegen.compose.ComposedUnit;
import com.jsonsource.generator.codegen.util.NamingUtil;
import com.jsonsource.generator.model.SourceUnit;
import com.jsonsource.generator.parser.SourceDiscovery;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the companion file {@code <Unit>Json.java} of a composed unit around its fragments.
 */
public class CompanionFileRenderer {

    private static final Logger log = LoggerFactory.getLogger(CompanionFileRenderer.class);

    static final List<String> RUNTIME_IMPORTS = List.of(
            "java.util.ArrayList",
            "java.util.LinkedHashMap",
            "java.util.LinkedHashSet",
            "java.util.List",
            "java.util.Map",
            "java.util.Set",
            "java.util.function.Function");

    private final Configuration freemarkerConfig;
    private final Path outputDir;

    /**
     * @param outputDir root of a separate output tree, or {@code null} to write companions next to their units
     */
    public CompanionFileRenderer(Path outputDir) {
        this.outputDir = outputDir;
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

    public GeneratedFile render(ComposedUnit composed) {
        SourceUnit unit = composed.getUnit();
        String className = NamingUtil.companionClassName(unit.getUnitName());

        ImportManager imports = new ImportManager(unit.getPackageName());
        imports.addImports(RUNTIME_IMPORTS);
        imports.addImports(unit.getImports());

        Map<String, Object> model = new HashMap<>();
        model.put("marker", SourceDiscovery.GENERATED_MARKER);
        model.put("packageName", unit.getPackageName());
        model.put("imports", imports.getImports());
        model.put("unitName", unit.getUnitName());
        model.put("className", className);
        model.put("body", indent(composed.getGenerated().render()));

        try {
            Template template = freemarkerConfig.getTemplate("companion.ftl");
            StringWriter out = new StringWriter();
            template.process(model, out);
            Path path = companionPath(unit, className);
            log.debug("Rendered {}", path);
            return new GeneratedFile(path, out.toString());
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render companion of " + unit.getPath(), e);
        }
    }

    Path companionPath(SourceUnit unit, String className) {
        String fileName = className + ".java";
        if (outputDir == null) {
            return unit.getPath().resolveSibling(fileName);
        }
        Path dir = outputDir;
        if (!unit.getPackageName().isEmpty()) {
            for (String segment : unit.getPackageName().split("\\.")) {
                dir = dir.resolve(segment);
            }
        }
        return dir.resolve(fileName);
    }

    /**
     * Indents every non-empty line by one level.
     */
    static String indent(String text) {
        StringBuilder sb = new StringBuilder();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            if (!lines[i].isEmpty()) {
                sb.append("    ").append(lines[i]);
            }
        }
        return sb.toString();
    }
}
