package com.gentoro.specops.extract;

import com.gentoro.specops.markdown.MarkdownDocument;
import java.util.List;

/**
 * A pure function from one parsed documentation file to typed records. Implementations perform
 * no I/O and keep no state between calls, so one instance may serve several threads.
 */
public interface ContentExtractor<T> {

  List<T> extract(MarkdownDocument document);

  default List<T> extract(String content, String filePath) {
    return extract(MarkdownDocument.parse(filePath, content));
  }
}
