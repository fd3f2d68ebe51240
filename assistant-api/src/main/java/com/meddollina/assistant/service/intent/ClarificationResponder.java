package com.meddollina.assistant.service.intent;

import com.meddollina.assistant.model.IntentResult;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class ClarificationResponder {

    static final String SYMPTOMS = "To give you accurate information I need more detail about your symptoms. Could you tell me:\n\n"
            + "• When did the symptoms start?\n"
            + "• How severe are they on a scale of 1-10?\n"
            + "• Are there any other symptoms?\n"
            + "• Does anything make them better or worse?";

    static final String CONDITION = "I'd like to help with your medical concern. Could you share a few more details:\n\n"
            + "• Which condition or symptoms are you dealing with?\n"
            + "• How long has this been going on?\n"
            + "• Have you received a diagnosis?";

    static final String TREATMENT = "To discuss treatment options I need to understand your situation better. Please tell me:\n\n"
            + "• Which condition are you seeking treatment for?\n"
            + "• Have you tried any treatments already?\n"
            + "• Do you have allergies or other medical conditions?";

    static final String MEDICATIONS = "For medication information I need a few specifics:\n\n"
            + "• Which condition is the medication for?\n"
            + "• Are you currently taking any medications?\n"
            + "• Do you have any known allergies?\n"
            + "• What is your age and general health status?";

    public String respond(IntentResult intent) {
        String needed = intent.needsClarification().orElse("").toLowerCase(Locale.ROOT);
        if (needed.contains("symptoms")) {
            return SYMPTOMS;
        }
        if (needed.contains("treatment") || needed.contains("medication")) {
            return TREATMENT;
        }
        if (needed.contains("dosage")) {
            return MEDICATIONS;
        }
        return CONDITION;
    }
}
