package pddl.model;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class VariableValueTest {

	@Test
	public void negate() {
		VariableValue value = new VariableValue("at truck1 depot1", true);

		assertThat(value.negate(), is(new VariableValue("at truck1 depot1", false)));
		assertThat(value.negate().negate(), is(value));
		assertFalse(value.isNumeric());
		assertTrue(value.isSupported());
	}

	@Test(expected = IllegalStateException.class)
	public void negateNumeric() {
		new VariableValue("fuel plane1", 1.5).negate();
	}

	@Test
	public void unsupported() {
		UnsupportedVariableValue value = new UnsupportedVariableValue(">= (fuel truck1) 0");

		assertFalse(value.isSupported());
		assertThat(value.negate(), is((VariableValue) value));
		assertThat(value, not((VariableValue) new VariableValue(">= (fuel truck1) 0", false)));
	}

	@Test
	public void timedValue() {
		TimedVariableValue value = new TimedVariableValue(2.5, new VariableValue("fuel plane1", 10));

		assertThat(value.getLiftedVariableName(), is("fuel"));
		assertThat(value.getValue(), is((Object) 10.0));
		assertThat(value.toString(), is("fuel plane1=10.0 @ 2.5"));
		assertTrue(value.sameValue(new TimedVariableValue(0, new VariableValue("fuel plane1", 10))));
		assertFalse(value.sameValue(new TimedVariableValue(2.5, new VariableValue("fuel plane1", 11))));
	}
}
