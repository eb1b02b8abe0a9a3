package eu.virtualparadox.titanshield.query.prompt;

import eu.virtualparadox.titanshield.query.model.Question;
import eu.virtualparadox.titanshield.rag.llm.AnswerLetterParser;
import eu.virtualparadox.titanshield.rag.retriever.model.ScoredChunk;
import eu.virtualparadox.titanshield.routing.RouteMode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mode-specific prompts for answering a question. Every prompt asks the model to finish with an explicit
 * {@code Đáp án: X} line, which {@link AnswerLetterParser} looks for first.
 */
@Component
public class PromptFactory {

    private static final String SYSTEM = String.join("\n",
            "Bạn là trợ lý trả lời câu hỏi trắc nghiệm tiếng Việt.",
            "Kết thúc câu trả lời bằng một dòng duy nhất theo mẫu: Đáp án: <chữ cái>");

    private static final String READING = String.join("\n",
            "Bạn là một chuyên gia phân tích văn bản. Hãy đọc đoạn văn bản được cung cấp và trả lời câu hỏi dựa "
                    + "HOÀN TOÀN trên thông tin trong đoạn văn.",
            "",
            "ĐỀ BÀI:",
            "%s",
            "",
            "CÁC LỰA CHỌN:",
            "%s",
            "",
            "Chỉ sử dụng thông tin từ đoạn văn. Chọn một đáp án trong số: %s.");

    private static final String STEM = String.join("\n",
            "Bạn là một chuyên gia toán học và khoa học. Hãy giải quyết câu hỏi này bằng cách suy nghĩ từng bước.",
            "",
            "Câu hỏi: %s",
            "",
            "Các lựa chọn:",
            "%s",
            "",
            "Xác định dữ kiện, chọn công thức phù hợp, tính toán và kiểm tra lại kết quả.",
            "Cuối cùng, chọn một đáp án trong số: %s.");

    private static final String RAG = String.join("\n",
            "Bạn là một trợ lý trả lời câu hỏi trắc nghiệm dựa trên thông tin được cung cấp.",
            "Ưu tiên thông tin trong ngữ cảnh; nếu ngữ cảnh không đủ, dùng kiến thức chung một cách thận trọng.",
            "",
            "NGỮ CẢNH:",
            "%s",
            "",
            "CÂU HỎI: %s",
            "",
            "CÁC LỰA CHỌN:",
            "%s",
            "",
            "Chọn một đáp án trong số: %s.");

    private static final String PLAIN = String.join("\n",
            "Hãy trả lời câu hỏi trắc nghiệm sau.",
            "",
            "CÂU HỎI: %s",
            "",
            "CÁC LỰA CHỌN:",
            "%s",
            "",
            "Chọn một đáp án trong số: %s.");

    public AnswerPrompt build(final Question question, final RouteMode mode, final List<ScoredChunk> context) {
        final String options = options(question);
        final String letters = AnswerLetterParser.lettersUpTo(question.optionCount());

        final String user;
        if (mode == RouteMode.READING) {
            user = String.format(READING, question.text(), options, letters);
        } else if (mode == RouteMode.STEM) {
            user = String.format(STEM, question.text(), options, letters);
        } else if (context == null || context.isEmpty()) {
            user = String.format(PLAIN, question.text(), options, letters);
        } else {
            user = String.format(RAG, context(context), question.text(), options, letters);
        }
        return new AnswerPrompt(SYSTEM, user);
    }

    private static String options(final Question question) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(question.optionCount(), AnswerLetterParser.MAX_OPTIONS); i++) {
            if (i > 0) {
                sb.append("\n");
            }
            sb.append(AnswerLetterParser.letterOf(i)).append(") ").append(question.options().get(i));
        }
        return sb.toString();
    }

    private static String context(final List<ScoredChunk> chunks) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append("[").append(i + 1).append("] ").append(chunks.get(i).chunk().text());
        }
        return sb.toString();
    }
}
