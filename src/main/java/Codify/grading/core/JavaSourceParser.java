package Codify.grading.core;

import Codify.grading.exception.analysisexception.SourceParseException;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;

public final class JavaSourceParser {
    private JavaSourceParser() {}

    // JavaParser 인스턴스는 thread-safe 하지 않으므로 호출마다 새로 만든다
    public static CompilationUnit parse(String source) {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false);
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source == null ? "" : source);

        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }

        Problem problem = result.getProblems().isEmpty() ? null : result.getProblems().get(0);
        if (problem == null) {
            throw new SourceParseException(0, "unknown parse failure");
        }
        int line = problem.getLocation()
                .flatMap(TokenRange::toRange)
                .map(range -> range.begin.line)
                .orElse(0);
        throw new SourceParseException(line, firstLine(problem.getMessage()));
    }

    private static String firstLine(String message) {
        if (message == null) return "unknown parse failure";
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
