package de.mirkosertic.docsearch.extraction;

import org.xml.sax.Attributes;
import org.xml.sax.helpers.DefaultHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Collects body text from Tika's XHTML event stream, split at {@code <div class="page">}
 * boundaries when the parser emits them (PDF). Block level elements end with a blank line
 * so that paragraph structure survives until normalization.
 */
class PagedTextContentHandler extends DefaultHandler {

    private static final Set<String> BLOCK_ELEMENTS = Set.of(
            "p", "div", "h1", "h2", "h3", "h4", "h5", "h6", "li", "tr", "pre",
            "blockquote", "table", "ul", "ol", "dl", "dd", "dt", "section", "article"
    );

    private final List<String> pages = new ArrayList<>();
    private final StringBuilder looseText = new StringBuilder();
    private StringBuilder currentPage;

    private int pageDepth;
    private boolean inBody;

    @Override
    public void startElement(final String uri, final String localName, final String qName, final Attributes attributes) {
        final String name = elementName(localName, qName);
        if ("body".equals(name)) {
            inBody = true;
            return;
        }
        if (!"div".equals(name)) {
            return;
        }
        if (pageDepth > 0) {
            pageDepth++;
        } else if ("page".equals(attributes.getValue("class"))) {
            pageDepth = 1;
            currentPage = new StringBuilder();
        }
    }

    @Override
    public void endElement(final String uri, final String localName, final String qName) {
        final String name = elementName(localName, qName);
        if ("body".equals(name)) {
            inBody = false;
            return;
        }
        if ("div".equals(name) && pageDepth > 0) {
            pageDepth--;
            if (pageDepth == 0) {
                pages.add(currentPage.toString());
                currentPage = null;
                return;
            }
        }
        if ("br".equals(name)) {
            target().append('\n');
        } else if (BLOCK_ELEMENTS.contains(name)) {
            target().append("\n\n");
        }
    }

    @Override
    public void characters(final char[] ch, final int start, final int length) {
        if (inBody) {
            target().append(ch, start, length);
        }
    }

    @Override
    public void ignorableWhitespace(final char[] ch, final int start, final int length) {
        characters(ch, start, length);
    }

    /**
     * Raw page texts in document order, or the whole body as one entry when no page
     * divisions were seen.
     */
    List<String> pages() {
        if (!pages.isEmpty()) {
            return List.copyOf(pages);
        }
        return List.of(looseText.toString());
    }

    boolean hasPageDivisions() {
        return !pages.isEmpty();
    }

    private StringBuilder target() {
        return currentPage != null ? currentPage : looseText;
    }

    private static String elementName(final String localName, final String qName) {
        return localName != null && !localName.isEmpty() ? localName : qName;
    }
}
