package pddl.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import pddl.lexer.PddlTokenType;
import pddl.model.DomainConstruct;
import pddl.model.DomainInfo;
import pddl.model.FileInfo;
import pddl.model.Variable;
import pddl.util.DocumentPositionResolver;

/**
 * Planning domain parser.
 */
public class PddlDomainParser {

	private static final Pattern ANY = Pattern.compile(".");

	/**
	 * @return the domain, or nothing if the tree has no `(define (domain name) ...)` header
	 */
	public Optional<DomainInfo> tryParse(String fileUri, int fileVersion, String fileText, PddlSyntaxTree syntaxTree,
			DocumentPositionResolver positionResolver) {
		Optional<PddlBracketNode> defineNode = syntaxTree.getDefineNode();
		if (!defineNode.isPresent()) {
			return Optional.empty();
		}
		Optional<PddlBracketNode> domainNode = defineNode.get().getFirstOpenBracket("domain");
		if (!domainNode.isPresent()) {
			return Optional.empty();
		}
		Optional<PddlSyntaxNode> domainNameNode = domainNode.get().getFirstChild(PddlTokenType.OTHER, ANY);
		if (!domainNameNode.isPresent()) {
			return Optional.empty();
		}

		DomainInfo domainInfo = new DomainInfo(fileUri, fileVersion, domainNameNode.get().getToken().getText(),
				syntaxTree, positionResolver);
		domainInfo.setText(fileText);
		parseDomainStructure(defineNode.get(), domainInfo, positionResolver);
		return Optional.of(domainInfo);
	}

	private void parseDomainStructure(PddlBracketNode defineNode, DomainInfo domainInfo,
			DocumentPositionResolver positionResolver) {
		parseRequirements(defineNode, domainInfo);

		defineNode.getFirstOpenBracket(":types").ifPresent(typesNode -> domainInfo.setTypeInheritance(
				PddlInheritanceParser.parseInheritance(typesNode.getNestedNonCommentText()), typesNode));

		defineNode.getFirstOpenBracket(":constants").ifPresent(constantsNode -> domainInfo.setConstants(
				PddlInheritanceParser.toTypeObjects(
						PddlInheritanceParser.parseInheritance(constantsNode.getNestedNonCommentText()))));

		defineNode.getFirstOpenBracket(":predicates").ifPresent(predicatesNode -> domainInfo.setPredicates(
				new VariablesParser(predicatesNode, positionResolver).getVariables()));

		defineNode.getFirstOpenBracket(":functions").ifPresent(functionsNode -> domainInfo.setFunctions(
				new VariablesParser(functionsNode, positionResolver).getVariables()));

		domainInfo.setDerived(parseDerived(defineNode, positionResolver));

		List<DomainConstruct> actions = parseActionProcessOrEvent(defineNode, ":action", positionResolver);
		for (PddlBracketNode actionNode : defineNode.getOpenBrackets(":durative-action")) {
			actions.add(DurativeActionParser.parse(actionNode, positionResolver));
		}
		domainInfo.setActions(actions);
		domainInfo.setProcesses(parseActionProcessOrEvent(defineNode, ":process", positionResolver));
		domainInfo.setEvents(parseActionProcessOrEvent(defineNode, ":event", positionResolver));

		defineNode.getFirstOpenBracket(":constraints").ifPresent(constraintsNode -> domainInfo.setConstraints(
				new PddlConstraintsParser().parseConstraints(constraintsNode)));
	}

	/**
	 * Reads the `(:requirements :strips ...)` keywords; shared by domains and problems.
	 */
	static void parseRequirements(PddlBracketNode defineNode, FileInfo fileInfo) {
		defineNode.getFirstOpenBracket(":requirements").ifPresent(requirementsNode -> {
			List<String> requirements = new ArrayList<>();
			for (PddlSyntaxNode node : requirementsNode.getNonWhitespaceChildren()) {
				if (node.isType(PddlTokenType.KEYWORD)) {
					requirements.add(node.getToken().getText());
				}
			}
			fileInfo.setRequirements(requirements);
		});
	}

	private static List<Variable> parseDerived(PddlBracketNode defineNode, DocumentPositionResolver positionResolver) {
		List<Variable> derived = new ArrayList<>();
		for (PddlBracketNode derivedNode : defineNode.getOpenBrackets(":derived")) {
			new DerivedVariablesParser(derivedNode, positionResolver).getVariable().ifPresent(derived::add);
		}
		return derived;
	}

	private static List<DomainConstruct> parseActionProcessOrEvent(PddlBracketNode defineNode, String keyword,
			DocumentPositionResolver positionResolver) {
		List<DomainConstruct> constructs = new ArrayList<>();
		for (PddlBracketNode node : defineNode.getOpenBrackets(keyword)) {
			constructs.add(InstantActionParser.parse(node, positionResolver));
		}
		return constructs;
	}
}
