package pddl;

/**
 * Invalid or unreadable parser configuration.
 */
public class PddlOptionException extends PddlException {

	private static final long serialVersionUID = 7316528046640170418L;
	private static final String prefix = "Configuration Error";

	public PddlOptionException(String msg) {
		super(prefix, msg);
	}

	public PddlOptionException(String msg, Throwable cause) {
		super(prefix, msg, cause);
	}
}
