package com.flamingo.ai.studymate.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.studymate.api.rest.AssistantController;
import com.flamingo.ai.studymate.api.rest.DocumentController;
import com.flamingo.ai.studymate.api.rest.LearnerController;
import com.flamingo.ai.studymate.api.rest.SessionController;
import com.flamingo.ai.studymate.api.rest.TutoringController;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Verifies the controller paths clients depend on:
 *
 * <ul>
 *   <li>POST /api/sessions/{sessionId}/assistant - Assistant turn within a session
 *   <li>POST /api/assistant - Session-less assistant turn
 *   <li>POST /api/documents - Register a document
 *   <li>/api/sessions - Session lifecycle, metadata and notes
 *   <li>/api/learners - Learner profiles and model updates
 *   <li>/api/tutoring - Tutoring sessions, interactions, explanations and practice
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("AssistantController API contract")
  class AssistantControllerContract {

    @Test
    @DisplayName("should be mapped under /api with session and session-less turns")
    void shouldExposeBothAssistantEndpoints() {
      RequestMapping mapping = AssistantController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
      assertThat(postPaths(AssistantController.class))
          .containsExactlyInAnyOrder("/sessions/{sessionId}/assistant", "/assistant");
    }
  }

  @Nested
  @DisplayName("DocumentController API contract")
  class DocumentControllerContract {

    @Test
    @DisplayName("should be mapped under /api prefix")
    void shouldBeMappedUnderApiPrefix() {
      RequestMapping mapping = DocumentController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
      assertThat(postPaths(DocumentController.class)).containsExactly("/documents");
    }
  }

  @Test
  @DisplayName("SessionController should be mapped to /api/sessions")
  void sessionControllerShouldBeMappedToApiSessions() {
    assertThat(SessionController.class.getAnnotation(RequestMapping.class).value())
        .containsExactly("/api/sessions");
  }

  @Test
  @DisplayName("LearnerController should be mapped to /api/learners")
  void learnerControllerShouldBeMappedToApiLearners() {
    assertThat(LearnerController.class.getAnnotation(RequestMapping.class).value())
        .containsExactly("/api/learners");
  }

  @Test
  @DisplayName("TutoringController should be mapped to /api/tutoring")
  void tutoringControllerShouldBeMappedToApiTutoring() {
    assertThat(TutoringController.class.getAnnotation(RequestMapping.class).value())
        .containsExactly("/api/tutoring");
    assertThat(postPaths(TutoringController.class))
        .contains("/sessions", "/ask", "/explanations", "/practice");
  }

  private static List<String> postPaths(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map(method -> method.getAnnotation(PostMapping.class))
        .filter(mapping -> mapping != null)
        .flatMap(mapping -> Arrays.stream(mapping.value()))
        .toList();
  }
}
