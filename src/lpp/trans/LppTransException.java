package lpp.trans;

import lpp.LppException;

/**
 * Stops compilation once a pass has reported issues. The details hold the formatted issue report.
 */
public class LppTransException extends LppException {

	private static final long serialVersionUID = 4177094561262805183L;

	public LppTransException(String report) {
		super("Compilation Error", report);
	}

}
