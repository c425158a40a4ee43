package com.flamingo.ai.studymate.service.dispatch;

import com.flamingo.ai.studymate.api.dto.request.TutorRequest;
import com.flamingo.ai.studymate.domain.entity.Bookmark;
import com.flamingo.ai.studymate.domain.entity.Document;
import com.flamingo.ai.studymate.domain.entity.Note;
import com.flamingo.ai.studymate.domain.entity.Session;
import com.flamingo.ai.studymate.domain.enums.ActionType;
import com.flamingo.ai.studymate.domain.enums.QueryRoute;
import com.flamingo.ai.studymate.domain.repository.BookmarkRepository;
import com.flamingo.ai.studymate.domain.repository.DocumentRepository;
import com.flamingo.ai.studymate.domain.repository.NoteRepository;
import com.flamingo.ai.studymate.domain.repository.SessionRepository;
import com.flamingo.ai.studymate.service.content.ContentAgentRequest;
import com.flamingo.ai.studymate.service.content.ContentAgentResult;
import com.flamingo.ai.studymate.service.content.ContentAgentService;
import com.flamingo.ai.studymate.service.dispatch.NoteTextExtractor.NoteDraft;
import com.flamingo.ai.studymate.service.rag.KnowledgeAnswer;
import com.flamingo.ai.studymate.service.rag.KnowledgeRouteHandler;
import com.flamingo.ai.studymate.service.routing.LocaleDigits;
import com.flamingo.ai.studymate.service.tutoring.TutorAgentService;
import com.flamingo.ai.studymate.service.tutoring.TutorResponse;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Executes routed actions and queries.
 *
 * <p>The pagination cursor and the open document live on the {@link Session} row, so each
 * session pages independently. A cursor of 0 means the document is open but no page has been
 * visited; navigation commits the new page only when it lies inside the document.
 *
 * <p>Every dispatched action and query appends a conversation turn, best-effort.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Dispatcher {

  static final String NO_DOCUMENT_LOADED = "No document available. Please upload a document first.";
  static final String END_OF_DOCUMENT = "End of document reached";
  static final String START_OF_DOCUMENT = "Already at the start of the document";
  static final String SESSION_REQUIRED = "This action requires a session.";
  static final String NOTE_TEXT_MISSING =
      "Note text is missing. Please tell me what the note should say.";
  static final String NO_DOCUMENT_OPEN = "No document is open.";

  private final SessionRepository sessionRepository;
  private final DocumentRepository documentRepository;
  private final NoteRepository noteRepository;
  private final BookmarkRepository bookmarkRepository;
  private final NoteTextExtractor noteTextExtractor;
  private final KnowledgeRouteHandler knowledgeRouteHandler;
  private final ContentAgentService contentAgentService;
  private final TutorAgentService tutorAgentService;
  private final ConversationTurnRecorder conversationTurnRecorder;
  private final MeterRegistry meterRegistry;

  @Timed(value = "dispatch.action", description = "Time to dispatch an action")
  public ActionResult dispatchAction(ActionRequest request) {
    Session session =
        request.sessionId() != null
            ? sessionRepository.findById(request.sessionId()).orElse(null)
            : null;

    ActionResult result =
        switch (request.type()) {
          case OPEN_DOC -> openDocument(request, session);
          case NEXT_SECTION -> nextSection(request, session);
          case PREV_SECTION -> previousSection(request, session);
          case ADD_NOTE -> addNote(request, session);
          case OPEN_NOTE -> openNotes(request, session);
          case BOOKMARK -> bookmark(request, session);
          case SHOW_BOOKMARKS -> showBookmarks(session);
          case OPEN_CHAT -> toggleChat(session, true);
          case CLOSE_CHAT -> toggleChat(session, false);
          case LOCATION -> location(session);
          case CLOSE_DOC -> closeDocument(session);
          case UNKNOWN ->
              ActionResult.of(
                  DispatchStatus.UNKNOWN_ACTION,
                  ActionType.UNKNOWN,
                  request.details() != null && !request.details().isBlank()
                      ? request.details()
                      : "Action type ambiguous or unavailable. Please clarify.");
        };

    log.info(
        "Dispatched action {} for session {}: {}",
        request.type().getLabel(),
        request.sessionId(),
        result.status().getLabel());
    meterRegistry
        .counter(
            "dispatch.actions",
            "action",
            request.type().getLabel(),
            "status",
            result.status().getLabel())
        .increment();
    conversationTurnRecorder.record(
        request.sessionId(), request.utterance(), result.message(), request.type().getLabel());
    return result;
  }

  @Timed(value = "dispatch.query", description = "Time to dispatch a query")
  public QueryResult dispatchQuery(QueryRequest request) {
    Session session =
        request.sessionId() != null
            ? sessionRepository.findById(request.sessionId()).orElse(null)
            : null;
    UUID explicitDocumentId =
        request.documentId() != null
            ? request.documentId()
            : session != null ? session.getCurrentDocumentId() : null;

    QueryResult result =
        switch (request.route()) {
          case QA, SUMMARIZATION -> knowledgeQuery(request, session, explicitDocumentId);
          case TUTOR_AGENT -> tutorQuery(request);
          case CONTENT_AGENT, UNKNOWN -> contentQuery(request, explicitDocumentId);
        };

    log.info(
        "Dispatched query route {} for session {}: {}",
        request.route().getLabel(),
        request.sessionId(),
        result.status().getLabel());
    meterRegistry
        .counter(
            "dispatch.queries",
            "route",
            request.route().getLabel(),
            "status",
            result.status().getLabel())
        .increment();
    conversationTurnRecorder.record(
        request.sessionId(), request.query(), result.response(), request.route().getLabel());
    return result;
  }

  // ---------------------------------------------------------------------------------------------
  // Queries
  // ---------------------------------------------------------------------------------------------

  private QueryResult knowledgeQuery(QueryRequest request, Session session, UUID explicitId) {
    Optional<Document> active = resolveDocument(explicitId, session);

    UUID scope = explicitId;
    if (scope == null && active.isPresent() && !belongsTo(active.get(), session)) {
      scope = active.get().getId();
    }

    KnowledgeAnswer answer =
        knowledgeRouteHandler.handle(
            request.sessionId(), scope, active.isPresent(), request.query(), request.route());

    DispatchStatus status =
        switch (answer.outcome()) {
          case ANSWERED -> DispatchStatus.SUCCESS;
          case NO_DOCUMENTS -> DispatchStatus.NO_DOCUMENT;
          case LOW_RELEVANCE -> DispatchStatus.EMPTY;
          case ERROR -> DispatchStatus.ERROR;
        };

    Map<String, Object> retrieval = new LinkedHashMap<>();
    retrieval.put("chunk_ids", answer.retrievalInfo().chunkIds());
    retrieval.put("similarity_scores", answer.retrievalInfo().similarityScores());
    retrieval.put("num_chunks", answer.retrievalInfo().numChunks());

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("document_id", scope);
    data.put("retrieval_info", retrieval);
    data.put("sources_used", answer.sourcesUsed());
    data.put("total_sources", answer.totalSources());
    data.put("context_length", answer.contextLength());
    return new QueryResult(status, request.route(), answer.response(), data);
  }

  private QueryResult contentQuery(QueryRequest request, UUID documentId) {
    ContentAgentResult result =
        contentAgentService.handle(
            new ContentAgentRequest(
                request.sessionId(),
                documentId,
                request.query(),
                request.learnerId(),
                conversationTurnRecorder.previousQuery(request.sessionId()).orElse(null)));

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("language", result.language());
    data.put("documents_available", result.documentsAvailable());
    data.put("delegated", result.delegated());
    data.put("adaptation", result.adaptation() != null ? result.adaptation().getLabel() : null);
    data.put("relevance_analysis", result.analysis());
    if (result.tutor() != null) {
      data.put("tutor", tutorData(result.tutor()));
    }
    return new QueryResult(DispatchStatus.SUCCESS, request.route(), result.response(), data);
  }

  private QueryResult tutorQuery(QueryRequest request) {
    TutorResponse tutor =
        tutorAgentService.tutor(
            TutorRequest.builder()
                .query(request.query())
                .learnerId(request.learnerId())
                .previousQuery(
                    conversationTurnRecorder.previousQuery(request.sessionId()).orElse(null))
                .build());
    DispatchStatus status =
        TutorAgentService.FAILURE.equals(tutor.response())
            ? DispatchStatus.ERROR
            : DispatchStatus.SUCCESS;
    return new QueryResult(status, request.route(), tutor.response(), tutorData(tutor));
  }

  private static Map<String, Object> tutorData(TutorResponse tutor) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("learner_id", tutor.learnerId());
    data.put("guest_session", tutor.guestSession());
    data.put("session_id", tutor.sessionId());
    data.put("inferred_indicators", tutor.inferredIndicators());
    return data;
  }

  // ---------------------------------------------------------------------------------------------
  // Navigation
  // ---------------------------------------------------------------------------------------------

  private ActionResult openDocument(ActionRequest request, Session session) {
    Optional<Document> resolved = resolveRequestedDocument(request, session);
    if (resolved.isEmpty()) {
      return ActionResult.of(
          DispatchStatus.NO_DOCUMENT, ActionType.OPEN_DOC, notFoundMessage(request));
    }
    Document document = resolved.get();
    Map<String, String> pages = pagesOf(document);

    if (session != null) {
      session.openDocument(document.getId());
      session.touch();
      sessionRepository.save(session);
    }

    List<Map<String, Object>> pageList = new ArrayList<>();
    new TreeMap<>(numericPages(pages))
        .forEach(
            (number, text) -> {
              Map<String, Object> page = new LinkedHashMap<>();
              page.put("page_number", number);
              page.put("text", text);
              pageList.add(page);
            });

    Map<String, Object> data = documentData(document, pages);
    data.put("pages", pageList);
    data.put("current_page", 0);
    return new ActionResult(
        DispatchStatus.SUCCESS,
        ActionType.OPEN_DOC,
        "Opened %s (%d pages)".formatted(document.getTitle(), pageList.size()),
        data);
  }

  private ActionResult nextSection(ActionRequest request, Session session) {
    return step(request, session, ActionType.NEXT_SECTION, 1);
  }

  private ActionResult previousSection(ActionRequest request, Session session) {
    return step(request, session, ActionType.PREV_SECTION, -1);
  }

  /** Moves the cursor by {@code delta}. The cursor is committed only for pages in range. */
  private ActionResult step(ActionRequest request, Session session, ActionType type, int delta) {
    if (session == null) {
      return ActionResult.of(DispatchStatus.ERROR, type, SESSION_REQUIRED);
    }
    Optional<Document> resolved = resolveRequestedDocument(request, session);
    if (resolved.isEmpty()) {
      return ActionResult.of(DispatchStatus.NO_DOCUMENT, type, notFoundMessage(request));
    }
    Document document = resolved.get();
    if (!document.getId().equals(session.getCurrentDocumentId())) {
      session.openDocument(document.getId());
    }

    Map<String, String> pages = pagesOf(document);
    OptionalInt maxPage = maxPage(pages);
    if (maxPage.isEmpty()) {
      return ActionResult.of(
          DispatchStatus.ERROR, type, "No document loaded or pages available");
    }

    int current = session.getCurrentPage() != null ? session.getCurrentPage() : 0;
    int target = current + delta;
    Map<String, Object> data = documentData(document, pages);

    if (delta > 0 && target > maxPage.getAsInt()) {
      data.put("page_number", current);
      sessionRepository.save(session);
      return new ActionResult(DispatchStatus.LIMIT_REACHED, type, END_OF_DOCUMENT, data);
    }
    if (delta < 0 && target < 1) {
      data.put("page_number", current);
      sessionRepository.save(session);
      return new ActionResult(DispatchStatus.START_OF_DOCUMENT, type, START_OF_DOCUMENT, data);
    }

    session.setCurrentPage(target);
    session.touch();
    sessionRepository.save(session);

    data.put("page_number", target);
    String text = pages.get(String.valueOf(target));
    if (text == null || text.isBlank()) {
      return new ActionResult(
          DispatchStatus.EMPTY, type, "No content found for page " + target + ".", data);
    }
    data.put("text", text);
    return new ActionResult(
        delta > 0 ? DispatchStatus.SUCCESS : DispatchStatus.OK,
        type,
        "Page %d of %s".formatted(target, document.getTitle()),
        data);
  }

  private ActionResult location(Session session) {
    if (session == null) {
      return ActionResult.of(DispatchStatus.ERROR, ActionType.LOCATION, SESSION_REQUIRED);
    }
    Optional<Document> open = openDocumentOf(session);
    if (open.isEmpty()) {
      return ActionResult.of(DispatchStatus.EMPTY, ActionType.LOCATION, NO_DOCUMENT_OPEN);
    }
    Document document = open.get();
    int page = session.getCurrentPage() != null ? session.getCurrentPage() : 0;

    Map<String, Object> data = documentData(document, pagesOf(document));
    data.put("current_page", page);
    String message =
        page > 0
            ? "You are on page %d of %s".formatted(page, document.getTitle())
            : "%s is open at the beginning".formatted(document.getTitle());
    return new ActionResult(DispatchStatus.OK, ActionType.LOCATION, message, data);
  }

  private ActionResult closeDocument(Session session) {
    if (session == null) {
      return ActionResult.of(DispatchStatus.ERROR, ActionType.CLOSE_DOC, SESSION_REQUIRED);
    }
    Optional<Document> open = openDocumentOf(session);
    if (open.isEmpty()) {
      return ActionResult.of(DispatchStatus.EMPTY, ActionType.CLOSE_DOC, NO_DOCUMENT_OPEN);
    }
    session.closeDocument();
    session.touch();
    sessionRepository.save(session);
    return ActionResult.of(
        DispatchStatus.SUCCESS, ActionType.CLOSE_DOC, "Closed " + open.get().getTitle());
  }

  // ---------------------------------------------------------------------------------------------
  // Notes and bookmarks
  // ---------------------------------------------------------------------------------------------

  private ActionResult addNote(ActionRequest request, Session session) {
    if (session == null) {
      return ActionResult.of(DispatchStatus.ERROR, ActionType.ADD_NOTE, SESSION_REQUIRED);
    }
    NoteDraft draft = noteTextExtractor.extract(request.arguments(), request.utterance());
    if (draft.text() == null) {
      return ActionResult.of(DispatchStatus.ERROR, ActionType.ADD_NOTE, NOTE_TEXT_MISSING);
    }

    UUID documentId = session.getCurrentDocumentId();
    Integer page = draft.pageNumber();
    int currentPage = session.getCurrentPage() != null ? session.getCurrentPage() : 0;
    if (page == null && documentId != null && currentPage > 0) {
      page = currentPage;
    }

    Note note =
        noteRepository.save(
            Note.builder()
                .sessionId(session.getId())
                .documentId(documentId)
                .content(draft.text())
                .pageNumber(page)
                .build());

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("note_id", note.getId());
    data.put("note_text", note.getContent());
    data.put("page_number", page);
    data.put("document_id", documentId);
    String message = page != null ? "Note added to page " + page : "Note added";
    return new ActionResult(DispatchStatus.SUCCESS, ActionType.ADD_NOTE, message, data);
  }

  private ActionResult openNotes(ActionRequest request, Session session) {
    if (session == null) {
      return ActionResult.of(DispatchStatus.ERROR, ActionType.OPEN_NOTE, SESSION_REQUIRED);
    }
    Integer page = request.arguments().pageNum();
    List<Note> notes =
        page != null
            ? noteRepository.findBySessionIdAndPageNumberOrderByCreatedAtAsc(session.getId(), page)
            : noteRepository.findBySessionIdOrderByCreatedAtAsc(session.getId());
    if (notes.isEmpty()) {
      return ActionResult.of(
          DispatchStatus.EMPTY,
          ActionType.OPEN_NOTE,
          page != null ? "No notes found for page " + page + "." : "No notes found.");
    }

    List<Map<String, Object>> entries = new ArrayList<>();
    for (Note note : notes) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("id", note.getId());
      entry.put("content", note.getContent());
      entry.put("page_number", note.getPageNumber());
      entry.put("document_id", note.getDocumentId());
      entry.put("created_at", note.getCreatedAt());
      entries.add(entry);
    }
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("notes", entries);
    data.put("page_filter", page);
    return new ActionResult(
        DispatchStatus.OK, ActionType.OPEN_NOTE, "Found " + notes.size() + " note(s)", data);
  }

  private ActionResult bookmark(ActionRequest request, Session session) {
    if (session == null) {
      return ActionResult.of(DispatchStatus.ERROR, ActionType.BOOKMARK, SESSION_REQUIRED);
    }
    Optional<Document> open = openDocumentOf(session);
    if (open.isEmpty()) {
      return ActionResult.of(DispatchStatus.NO_DOCUMENT, ActionType.BOOKMARK, NO_DOCUMENT_OPEN);
    }
    Integer page =
        request.arguments().pageNum() != null
            ? request.arguments().pageNum()
            : session.getCurrentPage();
    if (page == null || page < 1) {
      return ActionResult.of(
          DispatchStatus.ERROR, ActionType.BOOKMARK, "Open a page before bookmarking it.");
    }

    Document document = open.get();
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("document_id", document.getId());
    data.put("page_number", page);

    Optional<Bookmark> existing =
        bookmarkRepository.findBySessionIdAndDocumentIdAndPageNumber(
            session.getId(), document.getId(), page);
    if (existing.isPresent()) {
      data.put("bookmark_id", existing.get().getId());
      return new ActionResult(
          DispatchStatus.OK, ActionType.BOOKMARK, "Page " + page + " is already bookmarked.", data);
    }

    Bookmark saved =
        bookmarkRepository.save(
            Bookmark.builder()
                .sessionId(session.getId())
                .documentId(document.getId())
                .pageNumber(page)
                .label(document.getTitle() + " p." + page)
                .build());
    data.put("bookmark_id", saved.getId());
    return new ActionResult(
        DispatchStatus.SUCCESS,
        ActionType.BOOKMARK,
        "Bookmarked page %d of %s".formatted(page, document.getTitle()),
        data);
  }

  private ActionResult showBookmarks(Session session) {
    if (session == null) {
      return ActionResult.of(DispatchStatus.ERROR, ActionType.SHOW_BOOKMARKS, SESSION_REQUIRED);
    }
    List<Bookmark> bookmarks =
        bookmarkRepository.findBySessionIdOrderByCreatedAtAsc(session.getId());
    if (bookmarks.isEmpty()) {
      return ActionResult.of(DispatchStatus.EMPTY, ActionType.SHOW_BOOKMARKS, "No bookmarks yet.");
    }
    List<Map<String, Object>> entries = new ArrayList<>();
    for (Bookmark bookmark : bookmarks) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("id", bookmark.getId());
      entry.put("document_id", bookmark.getDocumentId());
      entry.put("page_number", bookmark.getPageNumber());
      entry.put("label", bookmark.getLabel());
      entries.add(entry);
    }
    return new ActionResult(
        DispatchStatus.OK,
        ActionType.SHOW_BOOKMARKS,
        "Found " + bookmarks.size() + " bookmark(s)",
        Map.of("bookmarks", entries));
  }

  private ActionResult toggleChat(Session session, boolean open) {
    ActionType type = open ? ActionType.OPEN_CHAT : ActionType.CLOSE_CHAT;
    if (session == null) {
      return ActionResult.of(DispatchStatus.ERROR, type, SESSION_REQUIRED);
    }
    Map<String, Object> patch = new LinkedHashMap<>();
    patch.put("chat_open", open);
    if (session.getMetadata() != null) {
      session.setMetadata(new LinkedHashMap<>(session.getMetadata()));
    }
    session.patchMetadata(patch);
    session.touch();
    sessionRepository.save(session);
    return new ActionResult(
        DispatchStatus.SUCCESS,
        type,
        open ? "Chat opened" : "Chat closed",
        Map.of("chat_open", open));
  }

  // ---------------------------------------------------------------------------------------------
  // Document resolution
  // ---------------------------------------------------------------------------------------------

  /**
   * Document named by the router arguments, else the session's open document, else its newest
   * upload. Only session-less callers fall back to the newest upload overall. A named document
   * that does not exist yields empty.
   */
  private Optional<Document> resolveRequestedDocument(ActionRequest request, Session session) {
    String reference = request.arguments().docId();
    if (reference != null && !reference.isBlank()) {
      return findByReference(reference.trim(), session);
    }
    return resolveDocument(null, session);
  }

  private Optional<Document> resolveDocument(UUID documentId, Session session) {
    if (documentId != null) {
      return documentRepository.findById(documentId);
    }
    if (session == null) {
      return documentRepository.findFirstByOrderByUploadedAtDesc();
    }
    if (session.getCurrentDocumentId() != null) {
      Optional<Document> current = documentRepository.findById(session.getCurrentDocumentId());
      if (current.isPresent()) {
        return current;
      }
    }
    return documentRepository.findFirstBySessionIdOrderByUploadedAtDesc(session.getId());
  }

  /** Resolves a router reference: a document id, or part of a title. */
  private Optional<Document> findByReference(String reference, Session session) {
    try {
      return documentRepository.findById(UUID.fromString(reference));
    } catch (IllegalArgumentException notAnId) {
      log.debug("Document reference '{}' is not an id, matching by title", reference);
    }
    if (session == null) {
      return documentRepository.findFirstByTitleContainingIgnoreCaseOrderByUploadedAtDesc(
          reference);
    }
    return documentRepository.findFirstBySessionIdAndTitleContainingIgnoreCaseOrderByUploadedAtDesc(
        session.getId(), reference);
  }

  private Optional<Document> openDocumentOf(Session session) {
    return session.getCurrentDocumentId() != null
        ? documentRepository.findById(session.getCurrentDocumentId())
        : Optional.empty();
  }

  private static boolean belongsTo(Document document, Session session) {
    return session != null
        && document.getSession() != null
        && session.getId().equals(document.getSession().getId());
  }

  private static String notFoundMessage(ActionRequest request) {
    String reference = request.arguments().docId();
    return reference != null && !reference.isBlank()
        ? "Document '" + reference + "' not found."
        : NO_DOCUMENT_LOADED;
  }

  /** Page map of a document; a document without pages is a single page of its content. */
  private static Map<String, String> pagesOf(Document document) {
    if (document.getPages() != null && !document.getPages().isEmpty()) {
      return document.getPages();
    }
    return document.getContent() != null ? Map.of("1", document.getContent()) : Map.of();
  }

  private static Map<Integer, String> numericPages(Map<String, String> pages) {
    Map<Integer, String> numeric = new LinkedHashMap<>();
    pages.forEach(
        (key, text) -> {
          if (!key.isEmpty() && key.chars().allMatch(Character::isDigit)) {
            Integer page = LocaleDigits.parseInteger(key);
            if (page != null) {
              numeric.put(page, text);
            }
          }
        });
    return numeric;
  }

  private static OptionalInt maxPage(Map<String, String> pages) {
    return numericPages(pages).keySet().stream().mapToInt(Integer::intValue).max();
  }

  private static Map<String, Object> documentData(Document document, Map<String, String> pages) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("document_id", document.getId());
    data.put("title", document.getTitle());
    data.put("total_pages", maxPage(pages).orElse(0));
    return data;
  }
}
