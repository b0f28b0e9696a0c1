package pddl;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import org.junit.Test;

import pddl.errors.ParsingProblem;
import pddl.formatters.SyntaxTreeFormatter;
import pddl.model.DomainConstruct;
import pddl.model.DomainInfo;
import pddl.model.FileInfo;
import pddl.model.ProblemInfo;
import pddl.model.Variable;
import pddl.parser.PddlSyntaxTreeBuilder;

public class PddlParserTest {

	@Test
	public void domain() {
		FileInfo fileInfo = new PddlParser().parse("file:///d.pddl", 1, "(define (domain d1) (:predicates (p)))");

		assertTrue(fileInfo.isDomain());
		assertThat(fileInfo.getName(), is("d1"));
		assertThat(((DomainInfo) fileInfo).getPredicates().size(), is(1));
		assertThat(fileInfo.getParsingProblems().size(), is(0));
	}

	@Test
	public void problem() {
		FileInfo fileInfo = new PddlParser().parse("file:///p.pddl", 2,
				"(define (problem p1) (:domain d1) (:init (p)))");

		assertTrue(fileInfo.isProblem());
		assertThat(((ProblemInfo) fileInfo).getDomainName(), is("d1"));
		assertThat(((ProblemInfo) fileInfo).getInits().size(), is(1));
	}

	@Test
	public void unknown() {
		String text = "(:action a)";
		FileInfo fileInfo = new PddlParser().parse("file:///a.pddl", 1, text);

		assertTrue(fileInfo.isUnknownPddl());
		assertFalse(fileInfo.isDomain());
		assertFalse(fileInfo.isProblem());
		assertThat(fileInfo.getName(), is(""));
		assertThat(fileInfo.getText(), is(text));
	}

	@Test
	public void parsingProblemsAreAttached() {
		FileInfo fileInfo = new PddlParser().parse("file:///d.pddl", 1, "(define (domain d1)\n  (:predicates (p)))\n)");

		assertTrue(fileInfo.isDomain());
		assertThat(fileInfo.getParsingProblems(), is(Arrays.asList(
				new ParsingProblem(PddlSyntaxTreeBuilder.UNMATCHED_CLOSE_BRACKET, 2, 0))));
	}

	@Test
	public void parsingProblemsAreCapped() {
		PddlParser parser = new PddlParser(new PddlParserOptions(2, false));
		FileInfo fileInfo = parser.parse("file:///x.pddl", 1, ")))))");

		assertTrue(fileInfo.isUnknownPddl());
		assertThat(fileInfo.getParsingProblems().size(), is(2));
		assertThat(parser.getOptions().maxNumberOfProblems, is(2));
	}

	@Test
	public void parseFile() throws IOException {
		Path path = Paths.get("test", "domains", "domain.pddl");
		FileInfo fileInfo = new PddlParser().parseFile(path, 7);

		assertTrue(fileInfo.isDomain());
		assertThat(fileInfo.getName(), is("logistics"));
		assertThat(fileInfo.getVersion(), is(7));
		assertThat(fileInfo.getFileUri(), is(path.toUri().toString()));
		assertTrue(fileInfo.getText().startsWith("; Deliveries"));
	}

	@Test
	public void verboseParser() {
		FileInfo fileInfo = new PddlParser(new PddlParserOptions(100, true)).parse("file:///p.pddl", 1, "(p");
		assertThat(fileInfo.getParsingProblems().size(), is(1));
	}

	@Test
	public void verboseRaisesPackageLogger() {
		Logger packageLogger = Logger.getLogger("pddl");
		Level previous = packageLogger.getLevel();
		try {
			new PddlParser(new PddlParserOptions(100, true));
			assertThat(packageLogger.getLevel(), is(Level.FINE));

			new PddlParser(new PddlParserOptions(100, false));
			assertThat(packageLogger.getLevel(), is(Level.FINE));
		} finally {
			packageLogger.setLevel(previous);
		}
	}

	@Test
	public void parsingIsRepeatable() throws IOException {
		Path path = Paths.get("test", "domains", "domain.pddl");
		PddlParser parser = new PddlParser();
		DomainInfo first = (DomainInfo) parser.parseFile(path, 1);
		DomainInfo second = (DomainInfo) parser.parseFile(path, 1);

		assertThat(SyntaxTreeFormatter.format(second.getSyntaxTree().getRootNode()),
				is(SyntaxTreeFormatter.format(first.getSyntaxTree().getRootNode())));
		assertThat(second.getRequirements(), is(first.getRequirements()));
		assertThat(second.getTypes(), is(first.getTypes()));
		assertThat(names(second.getPredicates()), is(names(first.getPredicates())));
		assertThat(names(second.getFunctions()), is(names(first.getFunctions())));
		assertThat(second.getStructures().stream().map(DomainConstruct::getNameOrEmpty).collect(Collectors.toList()),
				is(first.getStructures().stream().map(DomainConstruct::getNameOrEmpty).collect(Collectors.toList())));
		assertThat(second.getParsingProblems(), is(first.getParsingProblems()));
	}

	private static List<String> names(List<Variable> variables) {
		return variables.stream().map(Variable::getFullName).collect(Collectors.toList());
	}
}
