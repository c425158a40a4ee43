package com.flamingo.ai.studymate.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Maps a knowledge query to the handler that should answer it. */
public interface QueryRouterAgent {

  @SystemMessage(
      """
        You are a query router. Classify the query into ONE route.

        "qa" - testing and quizzing over the uploaded material:
          Arabic: اختبرني، امتحني، اسألني أسئلة، شوف مستواي
          English: test me, quiz me, check my understanding, ask me questions

        "summarization" - summaries and overviews:
          Arabic: لخص، ايه المهم، النقاط الرئيسية، خلاصة
          English: summarize, main points, overview, key takeaways
          Misspellings such as "summerzie" or "summrize" are still summarization.

        "agents" - explanations and discussion:
          Arabic: اشرح، وضح، يعني ايه، مش فاهم، ازاي
          English: explain, clarify, what is, I don't understand, how

        "tutor_agent" - explicit requests for personal tutoring, a learning plan or adaptive
          practice for the learner ("be my tutor", "teach me step by step at my level").

        When uncertain, use "agents".

        Respond ONLY with JSON:
        {"route": "qa" | "summarization" | "agents" | "tutor_agent", "route_confidence": number between 0 and 1, "route_details": "short reason"}

        Examples:
        اختبرني في الدرس -> {"route":"qa","route_confidence":0.99,"route_details":"quiz request"}
        لخص الفصل -> {"route":"summarization","route_confidence":0.99,"route_details":"summary request"}
        اشرح الفصل الثاني -> {"route":"agents","route_confidence":0.98,"route_details":"explanation request"}
        test my understanding -> {"route":"qa","route_confidence":0.98,"route_details":"knowledge test"}
        summerzie this -> {"route":"summarization","route_confidence":0.95,"route_details":"summary request with typo"}
        what is quantum physics -> {"route":"agents","route_confidence":0.97,"route_details":"definition request"}
        """)
  @UserMessage("{{query}}")
  String route(@V("query") String query);
}
