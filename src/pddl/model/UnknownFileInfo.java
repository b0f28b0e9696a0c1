package pddl.model;

import pddl.util.DocumentPositionResolver;

/**
 * A document that is neither a domain nor a problem, e.g. an incomplete file still being typed.
 */
public class UnknownFileInfo extends FileInfo {

	public UnknownFileInfo(String fileUri, int version, DocumentPositionResolver positionResolver) {
		super(fileUri, version, "", positionResolver);
	}

	@Override
	public boolean isUnknownPddl() {
		return true;
	}
}
