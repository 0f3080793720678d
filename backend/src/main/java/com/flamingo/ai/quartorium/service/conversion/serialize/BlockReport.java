package com.flamingo.ai.quartorium.service.conversion.serialize;

/**
 * Provenance of one block of serialized output.
 *
 * @param index position of the block in the output
 * @param nodeType tree node type the block was written from
 * @param blockKey block key, when the node had one
 */
public record BlockReport(
    int index, String nodeType, String blockKey, BlockProvenance provenance) {}
