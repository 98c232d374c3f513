package io.github.manjago.v8decomp.translate;

import io.github.manjago.v8decomp.flow.JumpType;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opcode table for the Ignition bytecodes of current V8 releases.
 * <p>
 * Statements use a small fixed vocabulary that later stages rely on:
 * <pre>
 * ACCU                 accumulator
 * r0, a0               registers and parameters
 * ConstPool[i]         constant pool entry i
 * Scope[CURRENT][i]    slot i of the current context
 * Scope[CURRENT-d][i]  slot i of the context d levels up
 * if (cond)            conditional jump, cond is the condition under which it is taken
 * </pre>
 * Old and new names of renamed opcodes ({@code LdaNamedProperty} and
 * {@code GetNamedProperty}) are both registered.
 */
public class V8OpcodeTable implements OpcodeTable {

    private static final Pattern TARGET_PATTERN = Pattern.compile("@\\s*(\\d+)");
    private static final Pattern SWITCH_ENTRY_PATTERN = Pattern.compile("(\\d+)\\s*:\\s*@\\s*(\\d+)");
    private static final Pattern REGISTER_RANGE_PATTERN = Pattern.compile("^([ra])(\\d+)-([ra])?(\\d+)$");
    private static final Pattern FEEDBACK_PATTERN = Pattern.compile("^\\[\\d+\\]$");
    private static final Pattern TYPEOF_FLAG_PATTERN = Pattern.compile("#(\\d+)");

    private static final String[] TYPEOF_LITERALS = {
            "\"number\"", "\"string\"", "\"symbol\"", "\"boolean\"", "\"bigint\"",
            "\"undefined\"", "\"function\"", "\"object\""
    };

    private final Map<String, OpcodeHandler> handlers = new LinkedHashMap<>();

    public V8OpcodeTable() {
        registerLoadsAndStores();
        registerContextAccess();
        registerPropertyAccess();
        registerArithmetic();
        registerComparisons();
        registerCalls();
        registerLiterals();
        registerControl();
        registerJumps();
        registerIteration();
    }

    @Override
    public @Nullable OpcodeHandler lookup(String mnemonic) {
        return handlers.get(mnemonic);
    }

    @Override
    public Set<String> mnemonics() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    protected final void register(String mnemonic, OpcodeHandler handler) {
        handlers.put(mnemonic, handler);
    }

    private void register(OpcodeHandler handler, String... mnemonics) {
        for (String mnemonic : mnemonics) {
            register(mnemonic, handler);
        }
    }

    // ========== Loads and stores ==========

    private void registerLoadsAndStores() {
        register("Ldar", ctx -> "ACCU = " + ctx.operand(0));
        register("Star", ctx -> ctx.operand(0) + " = ACCU");
        for (int i = 0; i <= 15; i++) {
            String target = "r" + i;
            register("Star" + i, ctx -> target + " = ACCU");
        }
        register("Mov", ctx -> ctx.operand(1) + " = " + ctx.operand(0));

        register("LdaZero", ctx -> "ACCU = 0");
        register("LdaSmi", ctx -> "ACCU = " + index(ctx.operand(0)));
        register("LdaUndefined", ctx -> "ACCU = undefined");
        register("LdaNull", ctx -> "ACCU = null");
        register("LdaTrue", ctx -> "ACCU = true");
        register("LdaFalse", ctx -> "ACCU = false");
        register("LdaTheHole", ctx -> "ACCU = <hole>");
        register(ctx -> "ACCU = ConstPool[" + index(ctx.operand(0)) + "]",
                "LdaConstant", "LdaGlobal", "LdaGlobalInsideTypeof",
                "LdaLookupSlot", "LdaLookupSlotInsideTypeof",
                "LdaLookupGlobalSlot", "LdaLookupGlobalSlotInsideTypeof",
                "LdaLookupContextSlot", "LdaLookupContextSlotInsideTypeof");
        register(ctx -> "ConstPool[" + index(ctx.operand(0)) + "] = ACCU",
                "StaGlobal", "StaLookupSlot");
    }

    // ========== Context slots ==========

    private void registerContextAccess() {
        register(ctx -> "ACCU = Scope[CURRENT][" + index(ctx.operand(0)) + "]",
                "LdaCurrentContextSlot", "LdaImmutableCurrentContextSlot");
        register("StaCurrentContextSlot", ctx -> "Scope[CURRENT][" + index(ctx.operand(0)) + "] = ACCU");

        register(ctx -> "ACCU = " + contextSlot(ctx),
                "LdaContextSlot", "LdaImmutableContextSlot");
        register("StaContextSlot", ctx -> contextSlot(ctx) + " = ACCU");

        register("PushContext", ctx -> "PushContext " + ctx.operand(0));
        register("PopContext", ctx -> "PopContext " + ctx.operand(0));

        register(ctx -> "ACCU = new Context(ConstPool[" + index(ctx.operand(0)) + "])",
                "CreateFunctionContext", "CreateBlockContext", "CreateEvalContext");
        register("CreateCatchContext",
                ctx -> "ACCU = new Context(ConstPool[" + index(ctx.operand(1)) + "], " + ctx.operand(0) + ")");
        register("CreateWithContext",
                ctx -> "ACCU = new Context(ConstPool[" + index(ctx.operand(1)) + "], " + ctx.operand(0) + ")");
    }

    /**
     * {@code <context>, [slot], [depth]} or {@code r1, [slot], [depth]} to a Scope expression.
     */
    private static String contextSlot(TranslationContext ctx) {
        String base = ctx.operand(0);
        String slot = index(ctx.operand(1));
        String depth = ctx.getOperands().size() > 2 ? index(ctx.operand(2)) : "0";
        String ref = base.equals("<context>") ? "CURRENT" : base;
        String scope = "0".equals(depth) ? ref : ref + "-" + depth;
        return "Scope[" + scope + "][" + slot + "]";
    }

    // ========== Properties ==========

    private void registerPropertyAccess() {
        register(ctx -> "ACCU = " + ctx.operand(0) + "[ConstPool[" + index(ctx.operand(1)) + "]]",
                "GetNamedProperty", "LdaNamedProperty", "LdaNamedPropertyNoFeedback");
        register(ctx -> "ACCU = super[ConstPool[" + index(ctx.operand(1)) + "]]",
                "GetNamedPropertyFromSuper", "LdaNamedPropertyFromSuper");
        register(ctx -> "ACCU = " + ctx.operand(0) + "[ACCU]",
                "GetKeyedProperty", "LdaKeyedProperty");
        register(ctx -> ctx.operand(0) + "[ConstPool[" + index(ctx.operand(1)) + "]] = ACCU",
                "SetNamedProperty", "StaNamedProperty", "StaNamedPropertyNoFeedback",
                "DefineNamedOwnProperty", "StaNamedOwnProperty");
        register(ctx -> ctx.operand(0) + "[" + ctx.operand(1) + "] = ACCU",
                "SetKeyedProperty", "StaKeyedProperty", "DefineKeyedOwnProperty",
                "StaKeyedPropertyAsDefine", "StaInArrayLiteral",
                "DefineKeyedOwnPropertyInLiteral", "StaDataPropertyInLiteral");
        register(ctx -> "ACCU = delete " + ctx.operand(0) + "[ACCU]",
                "DeletePropertyStrict", "DeletePropertySloppy");
        register("GetIterator", ctx -> "ACCU = " + ctx.operand(0) + "[Symbol.iterator]()");
    }

    // ========== Arithmetic ==========

    private void registerArithmetic() {
        Map<String, String> binary = new LinkedHashMap<>();
        binary.put("Add", "+");
        binary.put("Sub", "-");
        binary.put("Mul", "*");
        binary.put("Div", "/");
        binary.put("Mod", "%");
        binary.put("Exp", "**");
        binary.put("BitwiseOr", "|");
        binary.put("BitwiseXor", "^");
        binary.put("BitwiseAnd", "&");
        binary.put("ShiftLeft", "<<");
        binary.put("ShiftRight", ">>");
        binary.put("ShiftRightLogical", ">>>");
        binary.forEach((name, op) -> {
            register(name, ctx -> "ACCU = " + ctx.operand(0) + " " + op + " ACCU");
            register(name + "Smi", ctx -> "ACCU = ACCU " + op + " " + index(ctx.operand(0)));
        });

        register("Inc", ctx -> "ACCU = ACCU + 1");
        register("Dec", ctx -> "ACCU = ACCU - 1");
        register("Negate", ctx -> "ACCU = -ACCU");
        register("BitwiseNot", ctx -> "ACCU = ~ACCU");
        register(ctx -> "ACCU = !ACCU", "LogicalNot", "ToBooleanLogicalNot");
        register("TypeOf", ctx -> "ACCU = typeof ACCU");
        register(ctx -> "", "ToNumeric", "ToNumber");
        register("ToString", ctx -> "ACCU = String(ACCU)");
        register("ToObject", ctx -> ctx.operand(0) + " = Object(ACCU)");
        register("ToName", ctx -> ctx.operand(0) + " = ACCU");
    }

    // ========== Comparisons ==========

    private void registerComparisons() {
        Map<String, String> tests = new LinkedHashMap<>();
        tests.put("TestEqual", "==");
        tests.put("TestEqualStrict", "===");
        tests.put("TestReferenceEqual", "===");
        tests.put("TestLessThan", "<");
        tests.put("TestGreaterThan", ">");
        tests.put("TestLessThanOrEqual", "<=");
        tests.put("TestGreaterThanOrEqual", ">=");
        tests.put("TestInstanceOf", "instanceof");
        tests.put("TestIn", "in");
        tests.forEach((name, op) -> register(name, ctx -> "ACCU = " + ctx.operand(0) + " " + op + " ACCU"));

        register("TestNull", ctx -> "ACCU = ACCU === null");
        register("TestUndefined", ctx -> "ACCU = ACCU === undefined");
        register("TestUndetectable", ctx -> "ACCU = ACCU == null");
        register("TestTypeOf", ctx -> "ACCU = typeof ACCU == " + typeofLiteral(ctx.getRawOperands()));
    }

    private static String typeofLiteral(String operands) {
        Matcher m = TYPEOF_FLAG_PATTERN.matcher(operands);
        if (m.find()) {
            int flag = Integer.parseInt(m.group(1));
            if (flag >= 0 && flag < TYPEOF_LITERALS.length) {
                return TYPEOF_LITERALS[flag];
            }
        }
        return "\"other\"";
    }

    // ========== Calls ==========

    private void registerCalls() {
        // receiver is the first argument operand and is not shown
        register(ctx -> call(ctx.operand(0), arguments(ctx, 1, true)),
                "CallProperty", "CallProperty0", "CallProperty1", "CallProperty2",
                "CallAnyReceiver", "CallNoFeedback");
        register(ctx -> call(ctx.operand(0), arguments(ctx, 1, false)),
                "CallUndefinedReceiver", "CallUndefinedReceiver0", "CallUndefinedReceiver1",
                "CallUndefinedReceiver2");
        register("CallWithSpread", ctx -> call(ctx.operand(0), spread(arguments(ctx, 1, true))));

        register(ctx -> call(index(ctx.operand(0)), arguments(ctx, 1, false)),
                "CallRuntime", "CallJSRuntime", "InvokeIntrinsic");
        register("CallRuntimeForPair", ctx -> call(index(ctx.operand(0)), arguments(ctx, 1, false)));

        register("Construct", ctx -> "ACCU = new " + ctx.operand(0) + "(" + String.join(", ", arguments(ctx, 1, false)) + ")");
        register("ConstructWithSpread",
                ctx -> "ACCU = new " + ctx.operand(0) + "(" + String.join(", ", spread(arguments(ctx, 1, false))) + ")");
    }

    private static String call(String callee, List<String> args) {
        return "ACCU = " + callee + "(" + String.join(", ", args) + ")";
    }

    /**
     * Collect call arguments from operand {@code from} on, expanding register
     * ranges and dropping feedback slot operands.
     */
    private static List<String> arguments(TranslationContext ctx, int from, boolean dropReceiver) {
        List<String> args = new ArrayList<>();
        List<String> operands = ctx.getOperands();
        for (int i = from; i < operands.size(); i++) {
            String op = operands.get(i);
            if (FEEDBACK_PATTERN.matcher(op).matches()) {
                continue;
            }
            args.addAll(expandRange(op));
        }
        if (dropReceiver && !args.isEmpty()) {
            args.remove(0);
        }
        return args;
    }

    private static List<String> spread(List<String> args) {
        if (!args.isEmpty()) {
            int last = args.size() - 1;
            args.set(last, "..." + args.get(last));
        }
        return args;
    }

    /**
     * {@code r1-r3} to {@code [r1, r2, r3]}; anything else as a single element.
     */
    static List<String> expandRange(String operand) {
        Matcher m = REGISTER_RANGE_PATTERN.matcher(operand);
        if (!m.matches()) {
            return List.of(operand);
        }
        String prefix = m.group(1);
        int from = Integer.parseInt(m.group(2));
        int to = Integer.parseInt(m.group(4));
        List<String> out = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            out.add(prefix + i);
        }
        return out;
    }

    // ========== Literals ==========

    private void registerLiterals() {
        register(ctx -> "ACCU = ConstPool[" + index(ctx.operand(0)) + "]",
                "CreateClosure", "CreateObjectLiteral", "CreateArrayLiteral", "GetTemplateObject");
        register("CreateEmptyObjectLiteral", ctx -> "ACCU = {}");
        register("CreateEmptyArrayLiteral", ctx -> "ACCU = []");
        register("CreateArrayFromIterable", ctx -> "ACCU = [...ACCU]");
        register("CreateRegExpLiteral", ctx -> "ACCU = new RegExp(ConstPool[" + index(ctx.operand(0)) + "])");
        register("CloneObject", ctx -> "ACCU = {..." + ctx.operand(0) + "}");
        register(ctx -> "ACCU = arguments",
                "CreateMappedArguments", "CreateUnmappedArguments", "CreateRestParameter");
    }

    // ========== Control ==========

    private void registerControl() {
        register("Return", ctx -> "return ACCU");
        register(ctx -> "throw ACCU", "Throw", "ReThrow");
        register("Debugger", ctx -> "debugger");
        register("SuspendGenerator", ctx -> "yield ACCU");
        register(ctx -> "",
                "StackCheck", "Nop", "SetPendingMessage", "Abort", "ResumeGenerator",
                "SwitchOnGeneratorState", "ThrowReferenceErrorIfHole",
                "ThrowSuperNotCalledIfHole", "ThrowSuperAlreadyCalledIfNotHole",
                "ThrowIfNotSuperConstructor");
    }

    // ========== Jumps ==========

    private void registerJumps() {
        register(ctx -> jump(ctx, JumpType.JUMP, ""), "Jump", "JumpConstant");
        register(ctx -> jump(ctx, JumpType.IF, "if (ACCU)"),
                "JumpIfTrue", "JumpIfTrueConstant", "JumpIfToBooleanTrue", "JumpIfToBooleanTrueConstant");
        register(ctx -> jump(ctx, JumpType.IF, "if (!ACCU)"),
                "JumpIfFalse", "JumpIfFalseConstant", "JumpIfToBooleanFalse", "JumpIfToBooleanFalseConstant");
        register(ctx -> jump(ctx, JumpType.IF, "if (ACCU == null)"),
                "JumpIfNull", "JumpIfNullConstant", "JumpIfUndefinedOrNull", "JumpIfUndefinedOrNullConstant");
        register(ctx -> jump(ctx, JumpType.IF, "if (ACCU != null)"), "JumpIfNotNull", "JumpIfNotNullConstant");
        register(ctx -> jump(ctx, JumpType.IF, "if (ACCU == undefined)"), "JumpIfUndefined", "JumpIfUndefinedConstant");
        register(ctx -> jump(ctx, JumpType.IF, "if (ACCU != undefined)"),
                "JumpIfNotUndefined", "JumpIfNotUndefinedConstant");
        register(ctx -> jump(ctx, JumpType.IF_JS_RECEIVER, ""), "JumpIfJSReceiver", "JumpIfJSReceiverConstant");

        register("JumpLoop", ctx -> {
            Integer target = jumpTarget(ctx, true);
            if (target != null) {
                ctx.addJump(JumpType.LOOP, target, ctx.getOffset());
            }
            return "";
        });
        register("SwitchOnSmiNoFeedback", V8OpcodeTable::intSwitch);
    }

    private static String jump(TranslationContext ctx, JumpType type, String text) {
        Integer target = jumpTarget(ctx, false);
        if (target != null) {
            ctx.addJump(type, ctx.getOffset(), target);
        }
        return text;
    }

    /**
     * Absolute target printed as {@code (0x... @ 22)}; otherwise the relative
     * operand, read from the constant pool for the Constant forms.
     *
     * @return target offset, or null when it cannot be determined
     */
    static @Nullable Integer jumpTarget(TranslationContext ctx, boolean backward) {
        Matcher m = TARGET_PATTERN.matcher(ctx.getRawOperands());
        if (m.find()) {
            return Integer.parseInt(m.group(1));
        }
        Integer distance = parseIntOrNull(index(ctx.operand(0)));
        if (distance == null) {
            return null;
        }
        if (ctx.getMnemonic().endsWith("Constant")) {
            String constant = ctx.constant(distance);
            distance = constant != null ? parseIntOrNull(constant.strip()) : null;
            if (distance == null) {
                return null;
            }
        }
        return backward ? ctx.getOffset() - distance : ctx.getOffset() + distance;
    }

    /**
     * {@code SwitchOnSmiNoFeedback [0], [2], [0] { 0: @6, 1: @10 }}: a head edge from
     * the switch to the first case, then one edge per case to the next case. The
     * last case points back at the switch. Values sharing a target share one case.
     */
    private static String intSwitch(TranslationContext ctx) {
        Map<Integer, List<String>> byTarget = new TreeMap<>();
        Matcher m = SWITCH_ENTRY_PATTERN.matcher(ctx.getRawOperands());
        while (m.find()) {
            byTarget.computeIfAbsent(Integer.parseInt(m.group(2)), k -> new ArrayList<>()).add(m.group(1));
        }
        if (byTarget.isEmpty()) {
            return "";
        }

        List<Integer> targets = new ArrayList<>(byTarget.keySet());
        int switchOffset = ctx.getOffset();
        ctx.addSwitchCase(switchOffset, targets.get(0), "switch (ACCU)", targets.get(targets.size() - 1));
        for (int i = 0; i < targets.size(); i++) {
            int start = targets.get(i);
            int end = i + 1 < targets.size() ? targets.get(i + 1) : switchOffset;
            List<String> labels = new ArrayList<>();
            for (String value : byTarget.get(start)) {
                labels.add("case " + value + ":");
            }
            ctx.addSwitchCase(start, end, String.join("\n", labels), null);
        }
        return "";
    }

    // ========== Iteration ==========

    private void registerIteration() {
        register("ForInEnumerate", ctx -> "ACCU = ForInEnumerate(" + ctx.operand(0) + ")");
        register("ForInPrepare", ctx -> "");
        register("ForInNext", ctx -> "ACCU = " + ctx.operand(0) + "[" + ctx.operand(1) + "]");
        register("ForInStep", ctx -> "ACCU = " + ctx.operand(0) + " + 1");
        register("ForInContinue", ctx -> "ACCU = " + ctx.operand(0) + " < " + ctx.operand(1));
    }

    // ========== Operand helpers ==========

    /**
     * {@code [12]} to {@code 12}; operands without brackets are returned as is.
     */
    static String index(String operand) {
        String s = operand.strip();
        if (s.startsWith("[") && s.endsWith("]") && s.length() >= 2) {
            return s.substring(1, s.length() - 1).strip();
        }
        return s;
    }

    private static @Nullable Integer parseIntOrNull(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
