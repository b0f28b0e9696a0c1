package pddl.hierarchy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import pddl.lexer.PddlTokenType;
import pddl.model.DomainConstruct;
import pddl.model.DomainConstructVisitor;
import pddl.model.DomainInfo;
import pddl.model.DurativeAction;
import pddl.model.Event;
import pddl.model.InstantAction;
import pddl.model.PreconditionEffectConstruct;
import pddl.model.Process;
import pddl.model.UnrecognizedStructure;
import pddl.model.Variable;
import pddl.model.effects.Assign;
import pddl.model.effects.Decrease;
import pddl.model.effects.Effect;
import pddl.model.effects.EffectVisitor;
import pddl.model.effects.Increase;
import pddl.model.effects.MakeFalse;
import pddl.model.effects.MakeTrue;
import pddl.model.effects.ScaleDown;
import pddl.model.effects.ScaleUp;
import pddl.model.effects.UnrecognizedEffect;
import pddl.model.effects.VariableEffect;
import pddl.parser.ActionEffectParser;
import pddl.parser.PddlBracketNode;
import pddl.parser.PddlSyntaxNode;

/**
 * Classifies how a variable is accessed at a given offset of a domain.
 *
 * From the node at the offset, the classifier finds the enclosing action,
 * process or event, decides whether the offset is in its duration, condition or
 * effect, and then climbs up to the smallest enclosing comparison or effect.
 * A reference that cannot be placed is UNRECOGNIZED; classification never fails.
 */
public class ModelHierarchy {

	private static final Pattern TIME_QUALIFIER = Pattern.compile(
			"^\\(\\s*(at\\s+start|at\\s+end|over\\s+all)", Pattern.CASE_INSENSITIVE);

	private static final List<String> CONDITION_OPERATORS = Arrays.asList("=", ">", "<", ">=", "<=", "not");
	private static final List<String> CONDITION_BOUNDARIES = Arrays.asList("and", "at start", "at end", "over all");
	private static final List<String> EFFECT_OPERATORS = Arrays.asList(
			"increase", "decrease", "scale-up", "scale-down", "assign", "not");
	private static final List<String> EFFECT_BOUNDARIES = Arrays.asList("and", "at start", "at end");

	private final DomainInfo domainInfo;

	public ModelHierarchy(DomainInfo domainInfo) {
		this.domainInfo = domainInfo;
	}

	/**
	 * @param variable the referenced predicate or function
	 * @param offset document offset of the reference
	 * @throws pddl.util.OffsetOutOfRangeException if the offset is outside the document
	 */
	public VariableReferenceInfo classify(Variable variable, int offset) {
		PddlSyntaxNode referenceNode = domainInfo.getSyntaxTree().getNodeAt(offset);

		for (DomainConstruct structure : domainInfo.getStructures()) {
			if (structure.includesIndex(offset)) {
				return structure.accept(new ReferenceClassifier(variable, offset, referenceNode));
			}
		}
		return new UnrecognizedVariableReferenceInfo();
	}

	/**
	 * Classifies every reference {@link DomainInfo#getVariableReferenceNodes(Variable)} finds.
	 */
	public List<VariableReferenceInfo> classifyAll(Variable variable) {
		List<VariableReferenceInfo> references = new ArrayList<>();
		for (PddlSyntaxNode node : domainInfo.getVariableReferenceNodes(variable)) {
			references.add(classify(variable, node.getStart() + 1));
		}
		return Collections.unmodifiableList(references);
	}

	private static class ReferenceClassifier extends DomainConstructVisitor<VariableReferenceInfo, RuntimeException> {

		private final Variable variable;
		private final int offset;
		private final PddlSyntaxNode referenceNode;

		ReferenceClassifier(Variable variable, int offset, PddlSyntaxNode referenceNode) {
			this.variable = variable;
			this.offset = offset;
			this.referenceNode = referenceNode;
		}

		private boolean includes(Optional<PddlBracketNode> part) {
			return part.isPresent() && part.get().includesIndex(offset);
		}

		@Override
		public VariableReferenceInfo visit(DurativeAction durativeAction) {
			PddlBracketNode timeQualifierNode = findTimeQualifier(referenceNode).orElse(null);
			if (includes(durativeAction.getDuration())) {
				return getReadOnlyReferenceInfo(referenceNode, durativeAction, ReferencePart.DURATION, null);
			} else if (includes(durativeAction.getCondition())) {
				return getReadOnlyReferenceInfo(referenceNode, durativeAction, ReferencePart.CONDITION, timeQualifierNode);
			} else if (includes(durativeAction.getEffect())) {
				return getEffectReferenceInfo(referenceNode, variable, durativeAction, timeQualifierNode);
			}
			String relevantCode = referenceNode.expand().map(PddlSyntaxNode::getText).orElse("");
			return new VariableReferenceInfo(durativeAction, null, ReferencePart.NONE,
					VariableReferenceKind.UNRECOGNIZED, relevantCode);
		}

		private VariableReferenceInfo visitPreconditionEffect(PreconditionEffectConstruct construct) {
			if (includes(construct.getPrecondition())) {
				return getReadOnlyReferenceInfo(referenceNode, construct, ReferencePart.CONDITION, null);
			} else if (includes(construct.getEffect())) {
				return getEffectReferenceInfo(referenceNode, variable, construct, null);
			}
			return new VariableReferenceInfo(construct, null, ReferencePart.NONE, VariableReferenceKind.UNRECOGNIZED, "");
		}

		@Override
		public VariableReferenceInfo visit(InstantAction instantAction) {
			return visitPreconditionEffect(instantAction);
		}

		@Override
		public VariableReferenceInfo visit(Process process) {
			return visitPreconditionEffect(process);
		}

		@Override
		public VariableReferenceInfo visit(Event event) {
			return visitPreconditionEffect(event);
		}

		@Override
		public VariableReferenceInfo visit(UnrecognizedStructure unrecognizedStructure) {
			return new UnrecognizedVariableReferenceInfo();
		}
	}

	private static VariableReferenceInfo getReadOnlyReferenceInfo(PddlSyntaxNode referenceNode,
			DomainConstruct structure, ReferencePart part, PddlBracketNode timeQualifierNode) {
		PddlSyntaxNode conditionNode = climb(referenceNode, CONDITION_OPERATORS, CONDITION_BOUNDARIES, timeQualifierNode);
		return new VariableReferenceInfo(structure, timeQualifierNode, part, VariableReferenceKind.READ,
				conditionNode.getText());
	}

	private static VariableReferenceInfo getEffectReferenceInfo(PddlSyntaxNode referenceNode, Variable variable,
			DomainConstruct structure, PddlBracketNode timeQualifierNode) {
		PddlSyntaxNode effectNode = climb(referenceNode, EFFECT_OPERATORS, EFFECT_BOUNDARIES, timeQualifierNode);
		Effect effect = ActionEffectParser.parseEffect(effectNode);
		boolean modifies = effect.accept(new ModifiesVisitor(variable));
		return new VariableEffectReferenceInfo(structure, timeQualifierNode,
				modifies ? VariableReferenceKind.WRITE : VariableReferenceKind.READ, effect);
	}

	/**
	 * Walks up from the node until it is one of the operators, or until its
	 * parent is a boundary: the time qualifier, a connective, a `:keyword` or the document.
	 */
	private static PddlSyntaxNode climb(PddlSyntaxNode node, List<String> operators, List<String> boundaries,
			PddlBracketNode timeQualifierNode) {
		PddlSyntaxNode current = node;
		while (!isOperator(current, operators)) {
			PddlSyntaxNode parent = current.getParent();
			if (parent == null || parent == timeQualifierNode || isBoundary(parent, boundaries)) {
				break;
			}
			current = parent;
		}
		return current;
	}

	private static boolean isOperator(PddlSyntaxNode node, List<String> operators) {
		return node.isType(PddlTokenType.OPEN_BRACKET_OPERATOR) && ((PddlBracketNode) node).isOperator(operators);
	}

	private static boolean isBoundary(PddlSyntaxNode node, List<String> boundaries) {
		if (node.isType(PddlTokenType.KEYWORD) || node.isDocument()) {
			return true;
		}
		if (!node.isType(PddlTokenType.OPEN_BRACKET_OPERATOR)) {
			return false;
		}
		PddlBracketNode bracket = (PddlBracketNode) node;
		return bracket.getOperator().startsWith(":") || bracket.isOperator(boundaries);
	}

	private static Optional<PddlBracketNode> findTimeQualifier(PddlSyntaxNode node) {
		return node.findAncestor(PddlTokenType.OPEN_BRACKET_OPERATOR, TIME_QUALIFIER)
				.map(ancestor -> (PddlBracketNode) ancestor);
	}

	private static class ModifiesVisitor extends EffectVisitor<Boolean, RuntimeException> {

		private final Variable variable;

		ModifiesVisitor(Variable variable) {
			this.variable = variable;
		}

		private Boolean modifies(VariableEffect effect) {
			return effect.modifies(variable);
		}

		@Override
		public Boolean visit(MakeTrue makeTrue) {
			return modifies(makeTrue);
		}

		@Override
		public Boolean visit(MakeFalse makeFalse) {
			return modifies(makeFalse);
		}

		@Override
		public Boolean visit(Assign assign) {
			return modifies(assign);
		}

		@Override
		public Boolean visit(Increase increase) {
			return modifies(increase);
		}

		@Override
		public Boolean visit(Decrease decrease) {
			return modifies(decrease);
		}

		@Override
		public Boolean visit(ScaleUp scaleUp) {
			return modifies(scaleUp);
		}

		@Override
		public Boolean visit(ScaleDown scaleDown) {
			return modifies(scaleDown);
		}

		@Override
		public Boolean visit(UnrecognizedEffect unrecognizedEffect) {
			return false;
		}
	}
}
