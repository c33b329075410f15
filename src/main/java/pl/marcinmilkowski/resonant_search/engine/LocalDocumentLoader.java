package pl.marcinmilkowski.resonant_search.engine;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Adds .txt and .html files from a directory tree to a {@link RankingEngine}.
 */
public class LocalDocumentLoader {

    private static final Logger logger = LoggerFactory.getLogger(LocalDocumentLoader.class);

    private final RankingEngine engine;

    public LocalDocumentLoader(RankingEngine engine) {
        this.engine = engine;
    }

    /**
     * Walk {@code dir} recursively and ingest every supported file. Unreadable
     * files and subdirectories are logged and skipped.
     *
     * @return number of documents added
     * @throws IOException if {@code dir} is not a directory
     */
    public int loadDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IOException("Not a directory: " + dir);
        }
        SupportedFileCollector collector = new SupportedFileCollector();
        Files.walkFileTree(dir, collector);
        List<Path> files = collector.files();
        Collections.sort(files);

        int added = 0;
        for (Path file : files) {
            try {
                if (loadFile(file)) {
                    added++;
                }
            } catch (IOException e) {
                logger.warn("Cannot read {}: {}", file, e.getMessage());
            }
        }
        logger.info("Loaded {} of {} files from {}", added, files.size(), dir);
        return added;
    }

    /**
     * @return true if the file produced a document
     */
    public boolean loadFile(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        String title = file.getFileName().toString();
        String text = content;
        if (isHtml(file)) {
            Document doc = Jsoup.parse(content);
            text = doc.body().text();
            if (!doc.title().isBlank()) {
                title = doc.title().trim();
            }
        }
        if (text.isBlank()) {
            logger.debug("Skipping empty file {}", file);
            return false;
        }
        return engine.addLocalDocument(title, text, file.toString());
    }

    static boolean isSupported(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".txt") || isHtml(file);
    }

    private static boolean isHtml(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".html") || name.endsWith(".htm");
    }

    /**
     * Collects supported regular files; entries that cannot be opened are logged
     * and the walk continues.
     */
    static class SupportedFileCollector extends SimpleFileVisitor<Path> {

        private final List<Path> files = new ArrayList<>();

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && isSupported(file)) {
                files.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            logger.warn("Cannot read {}: {}", file, exc.toString());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                logger.warn("Listing of {} stopped early: {}", dir, exc.toString());
            }
            return FileVisitResult.CONTINUE;
        }

        List<Path> files() {
            return files;
        }
    }
}
