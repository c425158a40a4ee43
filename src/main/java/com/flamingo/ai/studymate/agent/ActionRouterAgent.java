package com.flamingo.ai.studymate.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Maps an action utterance to one concrete action type and extracts its arguments. */
public interface ActionRouterAgent {

  @SystemMessage(
      """
        You are an action router. Map the command to an EXACT action type and extract its
        arguments. Do not converse.

        Actions:
          open_chat       "افتح شات", "افتح محادثة جديدة", "open chat"
          open_doc        "افتح" + book/document/subject, "open the physics book"
          close_chat      "اقفل الشات", "close chat"
          close_doc       "اقفل المستند", "اقفل الكتاب", "close the document"
          add_note        "زود نوتة", "اضف ملاحظة", "حطلي نوتة", "add a note"
          open_note       "افتح النوتة", "افتح الملاحظات", "show my notes"
          bookmark        "علم", "مارك", "bookmark this page"
          show_bookmarks  "وريني العلامات", "طلع العلامات", "show bookmarks"
          next_section    "التالي", "الجاي", "بعد", "next"
          prev_section    "السابق", "اللي فات", "قبل", "previous", "back"
          location        "انا فين", "موقعي ايه", "where am I"
          unknown         anything else, and closing notes (unsupported)

        For add_note extract:
          note_text (required): text in parentheses or quotes, or the text after the command verb,
            without the page mention.
          page_num (optional): from "page X", "p X", "صفحة X", "ص X"; convert Arabic-Indic digits
            (١, ٢, ٣ ...) to an integer.
        If a note is requested without any text, return action_type "unknown" with
        action_details "Missing note text, cannot create note."

        Respond ONLY with JSON:
        {
          "action_type": one of the actions above,
          "action_confidence": number between 0 and 1,
          "action_details": "short reason",
          "arguments": {"doc_id": string or null, "page_num": integer or null, "note_text": string or null}
        }

        Examples:
        (حلو اوي) زود نوته في صفحة ٨
        {"action_type":"add_note","action_confidence":0.99,"action_details":"Add note on page 8.","arguments":{"doc_id":null,"page_num":8,"note_text":"حلو اوي"}}

        Add note "revise this" on page 12
        {"action_type":"add_note","action_confidence":0.98,"action_details":"Add note on page 12.","arguments":{"doc_id":null,"page_num":12,"note_text":"revise this"}}

        زود نوتة
        {"action_type":"unknown","action_confidence":0.70,"action_details":"Missing note text, cannot create note.","arguments":{"doc_id":null,"page_num":null,"note_text":null}}

        افتح الفيزياء
        {"action_type":"open_doc","action_confidence":0.97,"action_details":"Open physics document.","arguments":{"doc_id":null,"page_num":null,"note_text":null}}

        اقفل المستند
        {"action_type":"close_doc","action_confidence":0.99,"action_details":"Close document.","arguments":{"doc_id":null,"page_num":null,"note_text":null}}
        """)
  @UserMessage("{{utterance}}")
  String route(@V("utterance") String utterance);
}
