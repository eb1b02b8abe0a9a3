package eu.virtualparadox.titanshield.routing;

import eu.virtualparadox.titanshield.knowledge.model.DocumentType;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Fixed rule tables of the {@link Router}. Patterns run against NFC-normalised text.
 */
final class RoutingRules {

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    /** Start and end of a whole word. */
    private static final String B = "(?<![\\p{L}\\p{N}])";
    private static final String E = "(?![\\p{L}\\p{N}])";

    record Rule(String label, Pattern pattern) {

        boolean matches(final String text) {
            return pattern.matcher(text).find();
        }
    }

    static final List<Rule> READING = List.of(
            rule("đoạn văn", B + "đoạn văn" + E),
            rule("bài đọc", B + "bài đọc" + E),
            rule("đoạn thông tin", B + "đoạn thông tin" + E),
            rule("dựa vào đoạn", B + "(?:dựa vào|dựa trên|theo) (?:nội dung )?(?:đoạn|văn bản|bài) (?:trên|sau|dưới đây)"),
            rule("context:", B + "context\\s*:"),
            rule("passage:", B + "passage\\s*:"),
            rule("text:", B + "text\\s*:"),
            rule("[n]", "\\[\\d{1,2}]"));

    static final List<Rule> STEM = List.of(
            rule("\\latex", "\\\\(?:int|sum|frac|sqrt|lim|prod|log|ln|sin|cos|tan)" + E),
            rule("tính", B + "(?<!(?:cá|thuộc|giới|đặc|bản|lý|tùy|tuỳ|cảm|trung|máy|hóa|hoá|nữ) )tính" + E + "(?!\\s+(?:chất|năng|cách|từ|đến|tình|mạng|thời|đa dạng|nhân văn|dân tộc))"),
            rule("giá trị", B + "giá trị" + E + "(?!\\s+(?:văn hóa|văn hoá|lịch sử|đạo đức|tinh thần|pháp lý|nhân văn|cốt lõi|truyền thống))"),
            rule("hàm số", B + "hàm số" + E),
            rule("phương trình", B + "phương trình" + E),
            rule("tích phân", B + "tích phân" + E),
            rule("đạo hàm", B + "đạo hàm" + E),
            rule("xác suất", B + "xác suất" + E),
            rule("lim", B + "lim" + E),
            rule("f(x)", B + "[fgh]\\s*\\(\\s*[xyt]\\s*\\)"),
            rule("^", "\\^"),
            rule("√", "√"));

    static final Pattern YEAR_AFTER_MARKER = Pattern.compile(B + "năm\\s+(\\d{4})" + E, FLAGS);
    static final Pattern ANY_YEAR = Pattern.compile("(?<!\\d)(\\d{4})(?!\\d)");
    static final int MIN_YEAR = 1900;
    static final int MAX_YEAR = 2100;

    /** Runs of capitalised words, e.g. {@code Hồ Chí Minh}. */
    static final Pattern CAPITALIZED_RUN = Pattern.compile("\\p{Lu}\\p{L}*(?:\\s+\\p{Lu}\\p{L}*)*");

    /** Legal and administrative references, e.g. {@code Điều 5}, {@code Nghị định số 100/2019/NĐ-CP}. */
    static final List<Pattern> DOMAIN_MARKERS = List.of(
            Pattern.compile(B + "(?:Điều|Khoản|Chương|Mục)\\s+\\d+" + E, FLAGS),
            Pattern.compile(B + "(?:Nghị định|Thông tư|Quyết định|Nghị quyết|Chỉ thị)\\s+(?:số\\s+)?\\d+[\\p{L}\\p{N}/\\-]*", FLAGS),
            Pattern.compile(B + "(?:Bộ luật|Luật)\\s+\\p{Lu}\\p{L}*(?:\\s+\\p{L}+){0,3}?(?=\\s+(?:năm\\s+)?\\d{4}|[,.?;:]|$)", Pattern.UNICODE_CHARACTER_CLASS));

    static final int MAX_ENTITIES = 5;

    static final Map<DocumentType, List<Pattern>> CATEGORY_KEYWORDS = categoryKeywords();

    private RoutingRules() {
        // prevent instantiation
    }

    private static Rule rule(final String label, final String regex) {
        return new Rule(label, Pattern.compile(regex, FLAGS));
    }

    private static Map<DocumentType, List<Pattern>> categoryKeywords() {
        final Map<DocumentType, List<Pattern>> map = new EnumMap<>(DocumentType.class);
        map.put(DocumentType.LAW, words("luật", "bộ luật", "pháp luật", "hiến pháp", "nghị định", "thông tư",
                "xử phạt", "vi phạm hành chính", "quyền và nghĩa vụ", "có hiệu lực", "tòa án", "hình sự", "dân sự"));
        map.put(DocumentType.HISTORY, words("lịch sử", "triều đại", "nhà Lý", "nhà Trần", "nhà Lê", "nhà Nguyễn",
                "kháng chiến", "khởi nghĩa", "chiến dịch", "chiến tranh", "cách mạng", "thế kỷ", "vua"));
        map.put(DocumentType.GEOGRAPHY, words("địa lý", "địa lí", "tỉnh", "sông", "núi", "đồng bằng", "cao nguyên",
                "khí hậu", "diện tích", "dân số", "vùng", "biển", "đảo"));
        map.put(DocumentType.CULTURE, words("văn hóa", "văn hoá", "lễ hội", "phong tục", "tập quán", "tín ngưỡng",
                "tôn giáo", "ẩm thực", "di sản", "truyền thống"));
        map.put(DocumentType.POLITICS, words("Đảng Cộng sản", "Quốc hội", "Chính phủ", "Chủ tịch nước",
                "Bộ Chính trị", "nhà nước", "tư tưởng Hồ Chí Minh", "quốc phòng"));
        return map;
    }

    private static List<Pattern> words(final String... words) {
        return Arrays.stream(words)
                .map(w -> Pattern.compile(B + Pattern.quote(w) + E, FLAGS))
                .toList();
    }
}
