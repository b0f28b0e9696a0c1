package pddl;

/**
 * A PDDL tooling exception consisting of a prefix (type of error) and a message.
 */
public abstract class PddlException extends Exception {

	private static final long serialVersionUID = -3209441305120186551L;

	private final String msg;
	private final String prefix;

	public PddlException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public PddlException(String prefix, String msg, Throwable cause) {
		super(prefix + ": " + msg, cause);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
