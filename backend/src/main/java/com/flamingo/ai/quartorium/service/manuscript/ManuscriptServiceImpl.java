package com.flamingo.ai.quartorium.service.manuscript;

import com.flamingo.ai.quartorium.service.conversion.comment.CommentAnchors;
import com.flamingo.ai.quartorium.service.conversion.comment.CommentExtraction;
import com.flamingo.ai.quartorium.service.conversion.comment.CommentExtractor;
import com.flamingo.ai.quartorium.service.conversion.comment.CommentThread;
import com.flamingo.ai.quartorium.service.conversion.jats.JatsDocumentParser;
import com.flamingo.ai.quartorium.service.conversion.jats.ReferenceContext;
import com.flamingo.ai.quartorium.service.conversion.jats.ReferenceContextBuilder;
import com.flamingo.ai.quartorium.service.conversion.jats.TreeTransformer;
import com.flamingo.ai.quartorium.service.conversion.render.AssetPathMapper;
import com.flamingo.ai.quartorium.service.conversion.render.RenderGateway;
import com.flamingo.ai.quartorium.service.conversion.render.RenderRequest;
import com.flamingo.ai.quartorium.service.conversion.render.RenderResult;
import com.flamingo.ai.quartorium.service.conversion.serialize.BlockProvenance;
import com.flamingo.ai.quartorium.service.conversion.serialize.SerializedSource;
import com.flamingo.ai.quartorium.service.conversion.serialize.TreeSerializer;
import com.flamingo.ai.quartorium.service.conversion.source.SourceOutline;
import com.flamingo.ai.quartorium.service.conversion.tree.DocNode;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;

/** Implementation of the ManuscriptService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManuscriptServiceImpl implements ManuscriptService {

  private final ProjectLocator projectLocator;
  private final CommentExtractor commentExtractor;
  private final CommentAnchors commentAnchors;
  private final RenderGateway renderGateway;
  private final JatsDocumentParser jatsParser;
  private final ReferenceContextBuilder contextBuilder;
  private final TreeTransformer treeTransformer;
  private final AssetPathMapper assetPathMapper;
  private final TreeSerializer treeSerializer;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "manuscript.view", description = "Time to build the editor view of a document")
  public DocumentView loadView(String projectId, String documentPath, String contentVersion) {
    log.info("Loading view of {} in project {}", documentPath, projectId);

    Path projectRoot = projectLocator.projectRoot(projectId);
    String relativePath = projectLocator.relativePath(projectId, documentPath);
    String source = projectLocator.readSource(projectId, relativePath);

    CommentExtraction extraction = commentExtractor.extractComments(source);
    String renderInput = commentAnchors.annotateForRender(extraction.remainingText());
    RenderRequest request =
        new RenderRequest(projectId, projectRoot, relativePath, renderInput, contentVersion);
    RenderResult result = renderGateway.render(request);

    Document rendered = jatsParser.parse(result.xml());
    ReferenceContext context = contextBuilder.buildContext(rendered);
    DocNode tree =
        treeTransformer.buildTree(
            rendered,
            context,
            assetPathMapper.baseRef(result.key()),
            SourceOutline.baseHeadingLevel(extraction.remainingText()));

    meterRegistry.counter("manuscript.views").increment();
    log.info(
        "Built view of {} at version {} with {} blocks and {} comment threads",
        request.documentId(),
        request.contentVersion(),
        tree.content().size(),
        extraction.comments().size());
    return new DocumentView(
        request.documentId(), request.contentVersion(), tree, extraction.comments());
  }

  @Override
  public SerializedSource serialize(
      DocNode tree, String originalSource, List<CommentThread> comments) {
    SerializedSource serialized = treeSerializer.serializeDetailed(tree, originalSource, comments);
    long reconstructed = serialized.count(BlockProvenance.RECONSTRUCTED);
    if (reconstructed > 0) {
      log.info("Serialized document with {} reconstructed blocks", reconstructed);
    }
    return serialized;
  }
}
