package com.flamingo.ai.studymate.service.document;

/**
 * A slice of document text ready for embedding.
 *
 * @param index position of the chunk within the document, starting at 0
 * @param pageNumber originating page; null when the document has no usable page map
 */
public record TextChunk(int index, Integer pageNumber, String content) {}
