package io.github.drompincen.sheetbridge.runtime.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.sheetbridge.protocol.api.SchemaProposal;
import io.github.drompincen.sheetbridge.protocol.error.AIProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@ConditionalOnProperty(name = "sheetbridge.ai.provider", havingValue = "chat", matchIfMissing = true)
public class ChatModelSchemaAdvisor implements SchemaAdvisor {

    private static final Logger log = LoggerFactory.getLogger(ChatModelSchemaAdvisor.class);

    static final String SYSTEM_PROMPT = """
            You design MongoDB collections for spreadsheet imports. For the column labels you are given:
            1. give each label a descriptive snake_case field name
            2. pick a data type from String, Number, Date, Boolean
            3. suggest indexes that help lookups
            4. name the fields that identify a record uniquely, for duplicate detection

            Answer with one JSON object and nothing else:
            {
              "normalized_attributes": {
                "<label exactly as given>": {
                  "field_name": "snake_case_name",
                  "data_type": "String|Number|Date|Boolean",
                  "description": "short description"
                }
              },
              "suggested_indexes": [
                {"field_names": ["field"], "index_type": "unique|ascending|descending|text", "reason": "why"}
              ],
              "duplicate_detection_columns": ["field"],
              "collection_name": "snake_case_collection"
            }

            Only list duplicate detection fields that really identify a record.""";

    private final ChatModel chatModel;
    private final SchemaProposalParser parser;

    public ChatModelSchemaAdvisor(@Autowired(required = false) ChatModel chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.parser = new SchemaProposalParser(objectMapper);
        log.info("ChatModelSchemaAdvisor initialized, model {}", chatModel != null ? "available" : "missing");
    }

    @Override
    public SchemaProposal propose(List<String> columnLabels) {
        if (chatModel == null) {
            throw new AIProcessingException("No chat model configured; set spring.ai.openai.api-key or use sheetbridge.ai.provider=heuristic");
        }
        StringBuilder user = new StringBuilder("Column labels of a spreadsheet that will be imported repeatedly:\n");
        columnLabels.forEach(label -> user.append("- ").append(label).append('\n'));

        Prompt prompt = new Prompt(List.of(new SystemMessage(SYSTEM_PROMPT), new UserMessage(user.toString())));
        ChatResponse response = chatModel.call(prompt);
        String text = response == null || response.getResult() == null || response.getResult().getOutput() == null
                ? null : response.getResult().getOutput().getText();
        log.debug("Schema advisor reply: {}", text);
        return parser.parse(text, columnLabels);
    }
}
