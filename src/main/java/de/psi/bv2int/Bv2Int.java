package de.psi.bv2int;

import java.util.List;

import org.apache.log4j.Logger;

import de.psi.bv2int.context.UserContext;
import de.psi.bv2int.preprocessing.AssertionPipeline;
import de.psi.bv2int.preprocessing.Bv2IntOptions;
import de.psi.bv2int.preprocessing.BvToInt;
import de.psi.bv2int.preprocessing.PassContext;
import de.psi.bv2int.smt.SExpr;
import de.psi.bv2int.smt.SMTFormula;
import de.psi.bv2int.smt.SmtLibReader;
import de.psi.bv2int.term.FunctionDefinition;
import de.psi.bv2int.term.Term;
import de.psi.bv2int.term.TermManager;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorSyntax;

/**
 * Translates an SMT-LIB script over bit-vectors into one over integers.
 */
public final class Bv2Int {
	private static final Logger log = Logger.getLogger(Bv2Int.class);

	private final UserContext userContext = new UserContext();
	private final PassContext context;
	private final BvToInt pass;
	private final SMTFormula output;
	private final AssertionPipeline pending = new AssertionPipeline();

	private Bv2Int(Bv2IntOptions options) throws Err {
		context = new PassContext(new TermManager(), userContext, options);
		pass = new BvToInt(context);
		output = new SMTFormula(options.logic, userContext);
	}

	public static SMTFormula execute(String document) throws Err {
		return execute(document, new Bv2IntOptions());
	}

	public static SMTFormula execute(String document, Bv2IntOptions options) throws Err {
		return execute("<input>", document, options);
	}

	public static SMTFormula execute(String filename, String document, Bv2IntOptions options) throws Err {
		final Bv2Int b = new Bv2Int(options);
		final SmtLibReader reader = new SmtLibReader(b.context.getTermManager());
		final List<SmtLibReader.Command> commands = reader.read(filename, document);
		log.info("read " + commands.size() + " command(s) from " + filename);
		for (SmtLibReader.Command c : commands) {
			switch (c.type) {
			case SET_LOGIC:
				break;
			case ASSERT:
				b.pending.push(c.term);
				break;
			case PUSH:
				b.flush();
				b.output.push(c.count);
				break;
			case POP:
				b.flush();
				if (c.count > b.userContext.getLevel())
					throw new ErrorSyntax("Cannot pop " + c.count + " level(s), only " + b.userContext.getLevel() + " pushed");
				b.output.pop(c.count);
				break;
			case CHECK_SAT:
				b.flush();
				b.output.addCommand(SExpr.<Term>call("check-sat"));
				break;
			case PASS_THROUGH:
				b.flush();
				b.output.addCommand(SExpr.<Term>sym(c.text));
				break;
			case EXIT:
				b.flush();
				b.output.addCommand(SExpr.<Term>call("exit"));
				return b.output;
			}
		}
		b.flush();
		return b.output;
	}

	/** Translates the assertions collected since the last flush and writes them out. */
	private void flush() throws Err {
		if (pending.size() == 0) return;
		pass.apply(pending);
		for (FunctionDefinition def : context.takeDefinitions()) {
			output.define(def);
		}
		for (Term a : pending.getAssertions()) {
			output.addConstraint(a);
		}
		pending.clear();
	}
}
