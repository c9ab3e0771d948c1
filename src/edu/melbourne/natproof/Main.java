package edu.melbourne.natproof;

import com.microsoft.z3.Context;
import edu.melbourne.natproof.logic.Theory;
import edu.melbourne.natproof.modal.Atom;
import edu.melbourne.natproof.modal.ModalAxiomSynthesis;
import edu.melbourne.natproof.modal.ModalFormula;
import edu.melbourne.natproof.prover.EscalationController;
import edu.melbourne.natproof.prover.EscalationSchedule;
import edu.melbourne.natproof.prover.LfpProblem;
import edu.melbourne.natproof.prover.LfpProofResult;
import edu.melbourne.natproof.prover.ProofBounds;
import edu.melbourne.natproof.smt.Z3Interface;
import java.io.File;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class Main {

    public static final String LOGGER_CONFIG = "log4j.properties";
    public static int MAX_ITERATIONS = 10;
    public static int MODAL_TEMPLATE_DEPTH = 2;
    public static int MODAL_FRAME_SIZE = 4;

    public static void main(String[] args) {
        if (args.length != 1 && args.length != 5) {
            usage();
            System.exit(1);
        }
        if (new File(LOGGER_CONFIG).isFile()) { //otherwise the one on the classpath
            Message.configureLogger(LOGGER_CONFIG);
        }
        String example = args[0].trim();

        Map<String, Theory> frames = ExampleTheories.getFrameTheories();
        if (frames.containsKey(example)) {
            if (args.length != 1) {
                usage();
                System.exit(1);
            }
            System.out.println(synthesizeAxioms(example, frames.get(example)));
            return;
        }

        LfpProblem problem = ExampleTheories.getProblems().get(example);
        if (problem == null) {
            System.err.println("Unknown example " + example);
            usage();
            System.exit(1);
        }
        ProofBounds initial = EscalationSchedule.DEFAULT_INITIAL_BOUNDS;
        if (args.length == 5) {
            try {
                initial = new ProofBounds(Integer.parseInt(args[1]), Integer.parseInt(args[2]),
                        Integer.parseInt(args[3]), Integer.parseInt(args[4]));
            } catch (IllegalArgumentException ex) { //NumberFormatException included
                System.err.println("Invalid bounds: " + ex.getMessage());
                usage();
                System.exit(1);
            }
        }

        long start = System.currentTimeMillis();
        LfpProofResult result = new EscalationController(EscalationSchedule.startingFrom(initial))
                .prove(problem, MAX_ITERATIONS);
        System.out.println(Message.showProofStatistics(example, result, System.currentTimeMillis() - start));
    }

    public static String synthesizeAxioms(String name, Theory goalTheory) {
        long start = System.currentTimeMillis();
        List<ModalFormula> axioms;
        try (Context ctx = new Z3Interface().getContext()) {
            axioms = new ModalAxiomSynthesis(ctx, ExampleTheories.trivial(), goalTheory, ExampleTheories.WORLD,
                    ExampleTheories.TRANSITION,
                    Collections.singletonMap(new Atom("p"), ExampleTheories.VALUATION_P),
                    MODAL_TEMPLATE_DEPTH, MODAL_FRAME_SIZE).synthesize();
        }
        return Message.showAxiomStatistics(name, axioms, System.currentTimeMillis() - start);
    }

    private static void usage() {
        System.err.println("Usage: progam <Example> [<np-depth> <term-depth> <formula-depth> <size-bound>]");
        System.err.println("  proof examples: " + ExampleTheories.getProblems().keySet());
        System.err.println("  frame examples: " + ExampleTheories.getFrameTheories().keySet());
    }
}
