package com.gentoro.specops.relationships;

import com.gentoro.specops.extract.HeadingClassifier;
import com.gentoro.specops.markdown.MarkdownDocument;
import com.gentoro.specops.markdown.OutlineSection;
import com.gentoro.specops.model.FileOutline;
import com.gentoro.specops.model.HeadingEntry;
import com.gentoro.specops.utility.StringUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Per-file heading outline with classification flags, importance and size figures. */
class ContentHierarchyBuilder {

  Map<String, FileOutline> build(Map<String, MarkdownDocument> documents) {
    Map<String, FileOutline> out = new LinkedHashMap<>();
    documents.forEach((path, doc) -> out.put(path, outline(path, doc)));
    return out;
  }

  FileOutline outline(String path, MarkdownDocument doc) {
    List<HeadingEntry> headings = new ArrayList<>(doc.sections().size());
    for (OutlineSection s : doc.sections()) {
      String lower = s.lowerTitle();
      headings.add(
          new HeadingEntry(
              s.level(),
              s.title(),
              HeadingClassifier.isConcept(lower),
              HeadingClassifier.isSetup(lower)));
    }
    return new FileOutline(
        headings,
        FileImportanceScorer.score(FileDependencyAnalyzer.fileName(path), doc),
        StringUtility.wordCount(doc.content()),
        doc.hasCodeBlocks());
  }
}
