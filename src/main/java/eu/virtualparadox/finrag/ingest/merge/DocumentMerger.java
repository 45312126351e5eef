package eu.virtualparadox.finrag.ingest.merge;

import eu.virtualparadox.finrag.ingest.page.PageResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the report body from page results: one {@code ## Page n} section per page, in page order.
 * <p>Pure and stateless. Every caller that needs merged text goes through this class.</p>
 */
@Component
public class DocumentMerger {

    public String merge(final List<PageResult> pageResults) {
        final List<String> sections = new ArrayList<>(pageResults.size());
        int previous = 0;

        for (final PageResult result : pageResults) {
            if (result.pageNumber() <= previous) {
                throw new IllegalStateException("Page results out of order: page " + result.pageNumber()
                        + " after page " + previous);
            }
            previous = result.pageNumber();

            final String content = result.parsedContent() == null ? "" : result.parsedContent().contentText();
            sections.add("## Page " + result.pageNumber() + "\n\n" + content + "\n\n");
        }

        return String.join("\n", sections);
    }
}
