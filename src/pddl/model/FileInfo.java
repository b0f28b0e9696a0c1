package pddl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import pddl.errors.ParsingProblem;
import pddl.util.DocumentPositionResolver;
import pddl.util.PddlRange;
import pddl.util.TextRange;

/**
 * A parsed PDDL file: a domain, a problem or an unrecognized document.
 */
public abstract class FileInfo {

	private final String fileUri;
	private final String name;
	private final DocumentPositionResolver positionResolver;
	private int version;
	private String text = "";
	private FileStatus status = FileStatus.PARSED;
	private final List<ParsingProblem> parsingProblems = new ArrayList<>();
	private List<String> requirements = Collections.emptyList();

	protected FileInfo(String fileUri, int version, String name, DocumentPositionResolver positionResolver) {
		this.fileUri = fileUri;
		this.version = version;
		this.name = name;
		this.positionResolver = positionResolver;
	}

	public String getFileUri() {
		return fileUri;
	}

	public int getVersion() {
		return version;
	}

	public String getName() {
		return name;
	}

	public String getText() {
		return text;
	}

	public void setText(String text) {
		this.text = text;
	}

	public boolean isDomain() {
		return false;
	}

	public boolean isProblem() {
		return false;
	}

	public boolean isUnknownPddl() {
		return false;
	}

	/**
	 * Records newer text; this file is dirty until re-parsed.
	 *
	 * @return true if the version was newer (or force was set)
	 */
	public boolean update(int version, String text, boolean force) {
		boolean isNewerVersion = version > this.version || force;
		if (isNewerVersion) {
			this.status = FileStatus.DIRTY;
			this.version = version;
			this.text = text;
		}
		return isNewerVersion;
	}

	public FileStatus getStatus() {
		return status;
	}

	public void setStatus(FileStatus status) {
		this.status = status;
	}

	public void addProblem(ParsingProblem parsingProblem) {
		parsingProblems.add(parsingProblem);
	}

	public void addProblems(List<ParsingProblem> problems) {
		parsingProblems.addAll(problems);
	}

	public List<ParsingProblem> getParsingProblems() {
		return Collections.unmodifiableList(parsingProblems);
	}

	public List<String> getRequirements() {
		return requirements;
	}

	public void setRequirements(List<String> requirements) {
		this.requirements = Collections.unmodifiableList(new ArrayList<>(requirements));
	}

	public DocumentPositionResolver getDocumentPositionResolver() {
		return positionResolver;
	}

	/**
	 * @return locations where the variable is referenced; none unless overridden
	 */
	public List<PddlRange> getVariableReferences(Variable variable) {
		return Collections.emptyList();
	}

	/**
	 * Finds `- typeName` occurrences outside of comments.
	 *
	 * @return ranges of the type names
	 */
	public List<PddlRange> getTypeReferences(String typeName) {
		List<PddlRange> referenceLocations = new ArrayList<>();
		Pattern pattern = Pattern.compile("-\\s+(" + Pattern.quote(typeName) + ")\\b", Pattern.CASE_INSENSITIVE);
		String[] lines = stripComments(text).split("\n", -1);
		for (int lineIdx = 0; lineIdx < lines.length; lineIdx++) {
			Matcher matcher = pattern.matcher(lines[lineIdx]);
			while (matcher.find()) {
				referenceLocations.add(new PddlRange(lineIdx, matcher.start(1), lineIdx, matcher.end(1)));
			}
		}
		return referenceLocations;
	}

	protected PddlRange getRange(TextRange node) {
		return positionResolver.resolveToRange(node);
	}

	/**
	 * Blanks out everything from `;` to the end of each line; line breaks become `\n`.
	 */
	public static String stripComments(String pddlText) {
		String[] lines = pddlText.split("\r?\n", -1);
		for (int i = 0; i < lines.length; i++) {
			int index = lines[i].indexOf(';');
			if (index > -1) {
				lines[i] = lines[i].substring(0, index);
			}
		}
		return String.join("\n", lines);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + " " + name + " (" + fileUri + " v" + version + ")";
	}
}
