package pddl.hierarchy;

import pddl.model.DomainConstruct;
import pddl.model.effects.Effect;
import pddl.parser.PddlBracketNode;

/**
 * A reference inside an effect, together with the effect it is part of.
 */
public class VariableEffectReferenceInfo extends VariableReferenceInfo {

	private final Effect effect;

	public VariableEffectReferenceInfo(DomainConstruct structure, PddlBracketNode timeQualifierNode,
			VariableReferenceKind kind, Effect effect) {
		super(structure, timeQualifierNode, ReferencePart.EFFECT, kind, effect.toPddlString());
		this.effect = effect;
	}

	public Effect getEffect() {
		return effect;
	}
}
