package com.relayline.service;

import com.relayline.context.AppDataContext;
import com.relayline.model.ChatRequest;
import com.relayline.model.Message;
import com.relayline.model.QueryType;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the provider-neutral message list: one system message tuned to chat type and query type,
 * optionally followed by the student's study context, then the user's message.
 */
public class PromptBuilder {

    static final String STUDY_ASSISTANT_BASE = "You are a helpful study assistant for BlockWise, an educational platform.";
    static final String GENERAL_BASE = "You are a helpful AI assistant for BlockWise users.";

    public List<Message> build(ChatRequest request, QueryType queryType, AppDataContext context) {
        List<Message> messages = new ArrayList<>(2);
        messages.add(Message.system(systemMessage(request.getChatType(), queryType, context)));
        messages.add(Message.user(request.getMessage()));
        return messages;
    }

    public String systemMessage(String chatType, QueryType queryType, AppDataContext context) {
        String base = ChatRequest.CHAT_TYPE_STUDY_ASSISTANT.equals(chatType) ? STUDY_ASSISTANT_BASE : GENERAL_BASE;

        StringBuilder system = new StringBuilder(base);
        switch (queryType) {
            case TIME_SENSITIVE:
                system.append(" You excel at providing current, time-sensitive information and answers. Be concise and accurate.");
                break;
            case APP_DATA:
                system.append(" You help students analyze their study progress and performance data. "
                        + "Provide insights based on their activity and achievements.");
                break;
            case GENERAL:
            default:
                system.append(" Provide helpful, accurate, and engaging responses to student questions.");
                break;
        }

        if (context != null && context.getStudyProgress() != null) {
            AppDataContext.StudyProgress progress = context.getStudyProgress();
            system.append("\n\nStudent Context:\n- Progress: ")
                    .append(progress.getCompletedBlocks()).append('/').append(progress.getTotalBlocks())
                    .append(" blocks completed\n- Accuracy: ")
                    .append(formatPercent(progress.getAccuracy())).append('%');
        }
        return system.toString();
    }

    private static String formatPercent(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
