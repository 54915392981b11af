package org.Aayush.tempus.state;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.tempus.core.id.IdInterner;
import org.Aayush.tempus.task.Action;
import org.Aayush.tempus.task.Atom;
import org.Aayush.tempus.task.DurationConstraint;
import org.Aayush.tempus.task.Effect;
import org.Aayush.tempus.task.FluentAssignment;
import org.Aayush.tempus.task.Formula;
import org.Aayush.tempus.task.NumericExpression;
import org.Aayush.tempus.task.PddlObject;
import org.Aayush.tempus.task.Task;
import org.Aayush.tempus.task.TypedParameter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Instantiates every lifted action over the type-compatible cross product of objects.
 *
 * <p>Fluents that no effect ever changes are folded into constants, so a duration such as
 * {@code (processing-time ?i)} becomes a number per instance. Equality atoms are decided
 * here as well; a binding whose start condition folds to false is not a valid instance and
 * is skipped.</p>
 */
@Slf4j
public final class Grounder {
    private static final String EQUALITY = "=";

    /**
     * Output of grounding one task.
     */
    public record Grounding(FactTable facts, GroundActionTable actions, State initialState, GroundFormula goal) {
    }

    public Grounding ground(Task task) {
        IdInterner facts = new IdInterner();
        IdInterner fluents = new IdInterner();

        Object2DoubleOpenHashMap<String> initialValues = new Object2DoubleOpenHashMap<>();
        initialValues.defaultReturnValue(Double.NaN);
        for (FluentAssignment assignment : task.getInitialFluents()) {
            initialValues.put(assignment.fluent().signature(), assignment.value());
        }
        Set<String> changingFunctions = new HashSet<>();
        for (Action action : task.getActions()) {
            collectUpdatedFunctions(action.getEffectsAtStart(), changingFunctions);
            collectUpdatedFunctions(action.getEffectsAtEnd(), changingFunctions);
        }
        for (Atom fact : task.getInitialFacts()) {
            facts.intern(fact.signature());
        }

        Compiler compiler = new Compiler(facts, fluents, changingFunctions, initialValues);
        List<GroundAction> grounded = new ArrayList<>();
        int skipped = 0;
        for (Action action : task.getActions()) {
            List<List<PddlObject>> candidates = new ArrayList<>(action.arity());
            boolean empty = false;
            for (TypedParameter parameter : action.getParameters()) {
                List<PddlObject> objects = task.objectsOfType(parameter.type());
                empty |= objects.isEmpty();
                candidates.add(objects);
            }
            if (empty) {
                continue;
            }
            int[] cursor = new int[action.arity()];
            do {
                Map<String, String> binding = new HashMap<>();
                List<String> arguments = new ArrayList<>(action.arity());
                for (int i = 0; i < cursor.length; i++) {
                    String object = candidates.get(i).get(cursor[i]).name();
                    binding.put(action.getParameters().get(i).name(), object);
                    arguments.add(object);
                }
                GroundAction instance = compiler.action(grounded.size(), action.substitute(binding), arguments);
                if (instance == null) {
                    skipped++;
                } else {
                    grounded.add(instance);
                }
            } while (advance(cursor, candidates));
        }
        GroundFormula goal = compiler.formula(task.getGoal(), Double.NaN);

        BitSet initialFacts = new BitSet(facts.size());
        for (Atom fact : task.getInitialFacts()) {
            initialFacts.set(facts.lookup(fact.signature()));
        }
        double[] initialFluents = new double[fluents.size()];
        Arrays.fill(initialFluents, Double.NaN);
        for (FluentAssignment assignment : task.getInitialFluents()) {
            int id = fluents.lookup(assignment.fluent().signature());
            if (id >= 0) {
                initialFluents[id] = assignment.value();
            }
        }

        FactTable table = new FactTable(facts.freeze(), fluents.freeze());
        State initial = new State(initialFacts, initialFluents, new PendingEffect[0], 0, 1);
        log.debug("Grounded {} lifted actions into {} instances ({} folded away), {} facts, {} changing fluents",
                task.getActions().size(), grounded.size(), skipped, table.factCount(), table.fluentCount());
        return new Grounding(table, new GroundActionTable(grounded), initial, goal);
    }

    private static boolean advance(int[] cursor, List<List<PddlObject>> candidates) {
        for (int i = cursor.length - 1; i >= 0; i--) {
            cursor[i]++;
            if (cursor[i] < candidates.get(i).size()) {
                return true;
            }
            cursor[i] = 0;
        }
        return false;
    }

    private static void collectUpdatedFunctions(List<Effect> effects, Set<String> sink) {
        for (Effect effect : effects) {
            if (effect instanceof Effect.NumericUpdate update) {
                sink.add(update.target().function());
            }
        }
    }

    /**
     * Translates substituted lifted structures into id-based ground ones.
     */
    private static final class Compiler {
        private final IdInterner facts;
        private final IdInterner fluents;
        private final Set<String> changingFunctions;
        private final Object2DoubleOpenHashMap<String> initialValues;

        Compiler(IdInterner facts, IdInterner fluents, Set<String> changingFunctions, Object2DoubleOpenHashMap<String> initialValues) {
            this.facts = facts;
            this.fluents = fluents;
            this.changingFunctions = changingFunctions;
            this.initialValues = initialValues;
        }

        GroundAction action(int id, Action action, List<String> arguments) {
            GroundExpression min;
            GroundExpression max;
            double fixedDuration = Double.NaN;
            if (action.isDurative()) {
                DurationConstraint duration = action.getDuration();
                min = duration.lower() == null ? new GroundExpression.Constant(0.0d) : expression(duration.lower(), Double.NaN);
                max = duration.upper() == null ? null : expression(duration.upper(), Double.NaN);
                if (duration.isFixed() && min instanceof GroundExpression.Constant constant) {
                    fixedDuration = constant.value();
                }
            } else {
                min = new GroundExpression.Constant(0.0d);
                max = new GroundExpression.Constant(0.0d);
                fixedDuration = 0.0d;
            }

            GroundFormula atStart = conjunction(action.getConditionsAtStart(), fixedDuration);
            if (GroundFormula.FALSE.equals(atStart)) {
                return null;
            }
            return GroundAction.builder()
                    .id(id)
                    .name(action.getName())
                    .arguments(List.copyOf(arguments))
                    .durative(action.isDurative())
                    .minDuration(min)
                    .maxDuration(max)
                    .conditionAtStart(atStart)
                    .conditionOverAll(conjunction(action.getConditionsOverAll(), fixedDuration))
                    .conditionAtEnd(conjunction(action.getConditionsAtEnd(), fixedDuration))
                    .effectsAtStart(effects(action.getEffectsAtStart(), fixedDuration))
                    .effectsAtEnd(effects(action.getEffectsAtEnd(), fixedDuration))
                    .build();
        }

        private GroundFormula conjunction(List<Formula> formulas, double duration) {
            List<GroundFormula> compiled = new ArrayList<>(formulas.size());
            for (Formula formula : formulas) {
                compiled.add(formula(formula, duration));
            }
            return GroundFormula.and(compiled);
        }

        GroundFormula formula(Formula formula, double duration) {
            if (formula instanceof Formula.AtomFormula atomFormula) {
                Atom atom = atomFormula.atom();
                if (EQUALITY.equals(atom.predicate())) {
                    return atom.arguments().get(0).equals(atom.arguments().get(1)) ? GroundFormula.TRUE : GroundFormula.FALSE;
                }
                return new GroundFormula.Fact(facts.intern(atom.signature()));
            }
            if (formula instanceof Formula.Not not) {
                return GroundFormula.not(formula(not.operand(), duration));
            }
            if (formula instanceof Formula.And and) {
                List<GroundFormula> operands = new ArrayList<>(and.operands().size());
                and.operands().forEach(operand -> operands.add(formula(operand, duration)));
                return GroundFormula.and(operands);
            }
            if (formula instanceof Formula.Or or) {
                List<GroundFormula> operands = new ArrayList<>(or.operands().size());
                or.operands().forEach(operand -> operands.add(formula(operand, duration)));
                return GroundFormula.or(operands);
            }
            if (formula instanceof Formula.Comparison comparison) {
                GroundExpression left = expression(comparison.left(), duration);
                GroundExpression right = expression(comparison.right(), duration);
                if (left instanceof GroundExpression.Constant l && right instanceof GroundExpression.Constant r) {
                    return comparison.comparator().test(l.value(), r.value()) ? GroundFormula.TRUE : GroundFormula.FALSE;
                }
                return new GroundFormula.Comparison(comparison.comparator(), left, right);
            }
            throw new IllegalArgumentException("unsupported formula " + formula);
        }

        GroundExpression expression(NumericExpression expression, double duration) {
            if (expression instanceof NumericExpression.Constant constant) {
                return new GroundExpression.Constant(constant.value());
            }
            if (expression instanceof NumericExpression.FluentTerm fluent) {
                if (changingFunctions.contains(fluent.function())) {
                    return new GroundExpression.Fluent(fluents.intern(fluent.signature()));
                }
                return new GroundExpression.Constant(initialValues.getDouble(fluent.signature()));
            }
            if (expression instanceof NumericExpression.DurationVariable) {
                return Double.isNaN(duration) ? new GroundExpression.Duration() : new GroundExpression.Constant(duration);
            }
            if (expression instanceof NumericExpression.Negation negation) {
                GroundExpression operand = expression(negation.operand(), duration);
                if (operand instanceof GroundExpression.Constant constant) {
                    return new GroundExpression.Constant(-constant.value());
                }
                return new GroundExpression.Negation(operand);
            }
            if (expression instanceof NumericExpression.Binary binary) {
                GroundExpression left = expression(binary.left(), duration);
                GroundExpression right = expression(binary.right(), duration);
                if (left instanceof GroundExpression.Constant l && right instanceof GroundExpression.Constant r) {
                    return new GroundExpression.Constant(binary.operator().apply(l.value(), r.value()));
                }
                return new GroundExpression.Binary(binary.operator(), left, right);
            }
            throw new IllegalArgumentException("unsupported expression " + expression);
        }

        private GroundEffects effects(List<Effect> effects, double duration) {
            if (effects.isEmpty()) {
                return GroundEffects.NONE;
            }
            IntArrayList adds = new IntArrayList();
            IntArrayList deletes = new IntArrayList();
            List<GroundEffects.NumericEffect> numeric = new ArrayList<>();
            for (Effect effect : effects) {
                if (effect instanceof Effect.Literal literal) {
                    int fact = facts.intern(literal.atom().signature());
                    (literal.positive() ? adds : deletes).add(fact);
                } else if (effect instanceof Effect.NumericUpdate update) {
                    numeric.add(new GroundEffects.NumericEffect(
                            update.operator(),
                            fluents.intern(update.target().signature()),
                            expression(update.value(), duration)
                    ));
                } else {
                    throw new IllegalArgumentException("unsupported effect " + effect);
                }
            }
            return new GroundEffects(adds.toIntArray(), deletes.toIntArray(), numeric);
        }
    }
}
