package com.flamingo.ai.quartorium.service.conversion.render;

import com.flamingo.ai.quartorium.exception.RenderFailureException;
import java.util.Optional;

/** Boundary to the external document renderer. */
public interface RenderGateway {

  /**
   * Renders a source document to JATS, reusing a cached result for the same document version.
   *
   * @param request document, project and version to render
   * @return rendered markup and the location of its assets
   * @throws RenderFailureException if the renderer fails, times out or writes no XML
   */
  RenderResult render(RenderRequest request);

  /** Returns the cached render of {@code key}, if it is still cached. */
  Optional<RenderResult> findCached(RenderKey key);
}
