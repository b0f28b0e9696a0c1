package pddl;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;

import pddl.errors.TopLevelProblemContext;
import pddl.model.DomainInfo;
import pddl.model.FileInfo;
import pddl.model.ProblemInfo;
import pddl.model.UnknownFileInfo;
import pddl.parser.PddlDomainParser;
import pddl.parser.PddlProblemParser;
import pddl.parser.PddlSyntaxTree;
import pddl.parser.PddlSyntaxTreeBuilder;
import pddl.util.DocumentPositionResolver;
import pddl.util.SimpleDocumentPositionResolver;

/**
 * Entry point: parses the text of a PDDL file into a domain, a problem or an unknown file.
 *
 * Each call builds its own syntax tree and position resolver, so a parser may be
 * shared between threads.
 */
public class PddlParser {

	private static final Logger logger = Logger.getLogger(PddlParser.class.getName());
	// held so the level set on it is not lost to garbage collection
	private static final Logger packageLogger = Logger.getLogger("pddl");

	private final PddlParserOptions options;
	private final PddlDomainParser domainParser = new PddlDomainParser();
	private final PddlProblemParser problemParser = new PddlProblemParser();

	/**
	 * With {@link PddlParserOptions#verbose} set, raises the shared {@code pddl} logger to FINE
	 * for the whole process. The level is never lowered again, and parsers built later
	 * without verbose keep logging at FINE.
	 */
	public PddlParser(PddlParserOptions options) {
		this.options = options;
		if (options.verbose) {
			packageLogger.setLevel(Level.FINE);
		}
	}

	public PddlParser() {
		this(new PddlParserOptions());
	}

	public PddlParserOptions getOptions() {
		return options;
	}

	/**
	 * @param fileUri identifies the file; not read
	 * @param version version of the text, as tracked by the caller
	 * @param text PDDL text
	 * @return a {@link DomainInfo}, a {@link ProblemInfo} or an {@link UnknownFileInfo}, with the parsing problems attached
	 */
	public FileInfo parse(String fileUri, int version, String text) {
		DocumentPositionResolver positionResolver = new SimpleDocumentPositionResolver(text);
		PddlSyntaxTreeBuilder builder = new PddlSyntaxTreeBuilder(text, positionResolver);
		PddlSyntaxTree syntaxTree = builder.getTree();

		FileInfo fileInfo;
		Optional<DomainInfo> domain = tryDomain(fileUri, version, text, syntaxTree, positionResolver);
		if (domain.isPresent()) {
			fileInfo = domain.get();
		} else {
			Optional<ProblemInfo> problem = tryProblem(fileUri, version, text, syntaxTree, positionResolver);
			if (problem.isPresent()) {
				fileInfo = problem.get();
			} else {
				fileInfo = new UnknownFileInfo(fileUri, version, positionResolver);
				fileInfo.setText(text);
			}
		}

		TopLevelProblemContext ctx = new TopLevelProblemContext(options.maxNumberOfProblems);
		ctx.errors(builder.getParsingProblems());
		fileInfo.addProblems(ctx.getProblems());

		logger.fine("Parsed " + fileUri + " v" + version + " as " + fileInfo.getClass().getSimpleName()
				+ " '" + fileInfo.getName() + "'");
		if (ctx.hasErrors()) {
			logger.fine(ctx.format());
		}
		return fileInfo;
	}

	/**
	 * Reads a UTF-8 file and parses it; the file URI is the path's URI.
	 */
	public FileInfo parseFile(Path path, int version) throws IOException {
		String text = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
		return parse(path.toUri().toString(), version, text);
	}

	/**
	 * @return the domain, or nothing if the tree is not a `(define (domain ...))`
	 */
	public Optional<DomainInfo> tryDomain(String fileUri, int version, String text, PddlSyntaxTree syntaxTree,
			DocumentPositionResolver positionResolver) {
		return domainParser.tryParse(fileUri, version, text, syntaxTree, positionResolver);
	}

	/**
	 * @return the problem, or nothing if the text is not a `(define (problem ...) (:domain ...))`
	 */
	public Optional<ProblemInfo> tryProblem(String fileUri, int version, String text, PddlSyntaxTree syntaxTree,
			DocumentPositionResolver positionResolver) {
		return problemParser.tryParse(fileUri, version, text, syntaxTree, positionResolver);
	}
}
