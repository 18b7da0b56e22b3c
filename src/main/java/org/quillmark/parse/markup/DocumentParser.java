package org.quillmark.parse.markup;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.quillmark.tree.Block;
import org.quillmark.tree.Document;
import org.quillmark.tree.InvalidBlock;
import org.quillmark.tree.LiteralBlock;
import org.quillmark.tree.RootElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a single document: an optional configuration header followed by blocks.
 * <p>
 * The header is HOCON enclosed in {@code {%} and {@code %}} at the very start of the
 * document. A malformed header does not abort the parse; it is kept as an invalid block.
 */
public class DocumentParser {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentParser.class);

    private static final String HEADER_START = "{%";
    private static final String HEADER_END = "%}";

    private final MarkupParsers markupParsers;

    public DocumentParser(MarkupParsers markupParsers) {
        this.markupParsers = markupParsers;
    }

    /**
     * Parses a document. Directives that need the assembled tree remain as placeholders.
     *
     * @param path The logical path of the document.
     * @param source The markup source.
     * @return The parsed document.
     */
    public Document parse(String path, String source) {
        String normalized = source.replace("\r\n", "\n");
        List<Block> blocks = new ArrayList<>();
        Config config = ConfigFactory.empty();
        String body = normalized;

        int headerEnd = normalized.startsWith(HEADER_START) ? normalized.indexOf(HEADER_END, HEADER_START.length()) : -1;
        if (headerEnd >= 0) {
            String header = normalized.substring(HEADER_START.length(), headerEnd);
            body = normalized.substring(headerEnd + HEADER_END.length());
            try {
                config = ConfigFactory.parseString(header).resolve();
            } catch (ConfigException e) {
                LOG.debug("Invalid config header in {}: {}", path, e.getMessage());
                String headerSource = normalized.substring(0, headerEnd + HEADER_END.length());
                blocks.add(InvalidBlock.of("Error parsing config header: " + e.getMessage(), new LiteralBlock(headerSource)));
            }
        }

        blocks.addAll(markupParsers.recursiveBlocks(body));
        LOG.debug("Parsed document {} with {} blocks", path, blocks.size());
        return new Document(path, new RootElement(blocks), config);
    }
}
