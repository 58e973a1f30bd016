package io.forthic.runtime;

import io.forthic.error.IntentionalStopException;
import io.forthic.model.RuntimeValue;
import io.forthic.model.RuntimeValues;
import io.forthic.module.Module;
import io.forthic.module.Variable;
import io.forthic.module.WordOptions;
import io.forthic.util.Jsons;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class CoreModule extends Module {
    public static final String NAME = "core";
    private static final Pattern INTERPOLATED_VARIABLE = Pattern.compile("(?:^|(?<=\\s))\\.([a-zA-Z_][a-zA-Z0-9_-]*)");
    private static final String ESCAPED_DOT = "\u0000ESCAPED_DOT\u0000";

    private final PrintStream out;

    public CoreModule() {
        this(System.out);
    }

    public CoreModule(PrintStream out) {
        super(NAME, "Essential interpreter operations for stack manipulation, variables, modules and profiling");
        this.out = out;
        registerStackWords();
        registerVariableWords();
        registerModuleWords();
        registerValueWords();
        registerProfilingWords();
        registerOutputWords();
    }

    private void registerStackWords() {
        addNativeWord("POP", "( a:any -- )", "Removes top item from stack", (inputs, options) -> null);
        addDirectWord("DUP", "( a:any -- a:any a:any )", "Duplicates top stack item", interp -> {
            RuntimeValue a = interp.pop();
            interp.push(a);
            interp.push(a);
        });
        addDirectWord("SWAP", "( a:any b:any -- b:any a:any )", "Swaps top two stack items", interp -> {
            RuntimeValue b = interp.pop();
            RuntimeValue a = interp.pop();
            interp.push(b);
            interp.push(a);
        });
        addDirectWord("PEEK!", "( -- )", "Prints top of stack and stops execution", interp -> {
            if (interp.stackSize() > 0) {
                out.println(RuntimeValues.describe(interp.peek()));
            } else {
                out.println("<STACK EMPTY>");
            }
            throw new IntentionalStopException("PEEK!");
        });
        addDirectWord("STACK!", "( -- )", "Prints entire stack (top first) and stops execution", interp -> {
            List<Object> items = new ArrayList<>();
            for (RuntimeValue value : interp.stackItems()) {
                items.add(RuntimeValues.toPlain(value));
            }
            Collections.reverse(items);
            out.println(Jsons.toJson(items));
            throw new IntentionalStopException("STACK!");
        });
    }

    private void registerVariableWords() {
        addDirectWord("VARIABLES", "( varnames:list -- )", "Creates variables in current module", interp -> {
            for (RuntimeValue name : RuntimeValues.requireArray(interp.pop(), "variable names").items()) {
                interp.declareVariable(RuntimeValues.requireString(name, "variable name"));
            }
        });
        addDirectWord("!", "( value:any variable:any -- )", "Sets variable value (auto-creates if string name)", interp -> {
            Variable variable = toVariable(interp, interp.pop());
            variable.set(interp.pop());
        });
        addDirectWord("@", "( variable:any -- value:any )", "Gets variable value (auto-creates if string name)", interp -> {
            interp.push(toVariable(interp, interp.pop()).value());
        });
        addDirectWord("!@", "( value:any variable:any -- value:any )", "Sets variable and returns value", interp -> {
            Variable variable = toVariable(interp, interp.pop());
            variable.set(interp.pop());
            interp.push(variable.value());
        });
    }

    private void registerModuleWords() {
        addDirectWord("INTERPRET", "( string:str -- )", "Interprets Forthic string in current context", interp -> {
            RuntimeValue code = interp.pop();
            if (!RuntimeValues.isMissing(code)) {
                interp.run(RuntimeValues.requireString(code, "code"));
            }
        });
        addDirectWord("EXPORT", "( names:list -- )", "Exports words from current module", interp -> {
            List<String> names = new ArrayList<>();
            for (RuntimeValue name : RuntimeValues.requireArray(interp.pop(), "word names").items()) {
                names.add(RuntimeValues.requireString(name, "word name"));
            }
            interp.curModule().addExportable(names);
        });
        addDirectWord("USE-MODULES", "( names:list -- )", "Imports modules by name or [name prefix] pair", interp -> {
            RuntimeValue names = interp.pop();
            if (!RuntimeValues.isNull(names)) {
                interp.useModules(RuntimeValues.requireArray(names, "module names").items());
            }
        });
    }

    private void registerValueWords() {
        addNativeWord("IDENTITY", "( -- )", "Does nothing (identity operation)", (inputs, options) -> null);
        addNativeWord("NOP", "( -- )", "Does nothing (no operation)", (inputs, options) -> null);
        addNativeWord("NULL", "( -- null:any )", "Pushes null onto stack", (inputs, options) -> RuntimeValue.NULL);
        addNativeWord("ARRAY?", "( value:any -- boolean:bool )", "Returns true if value is an array",
                (inputs, options) -> RuntimeValue.ofBool(inputs.get(0).kind() == RuntimeValue.Kind.ARRAY));
        addNativeWord("DEFAULT", "( value:any default_value:any -- result:any )",
                "Returns value or default if value is null or an empty string",
                (inputs, options) -> RuntimeValues.isMissing(inputs.get(0)) ? inputs.get(1) : inputs.get(0));
        addDirectWord("*DEFAULT", "( value:any default_forthic:str -- result:any )",
                "Returns value or runs Forthic if value is null or an empty string", interp -> {
                    String defaultForthic = RuntimeValues.requireString(interp.pop(), "default code");
                    RuntimeValue value = interp.pop();
                    if (RuntimeValues.isMissing(value)) {
                        interp.run(defaultForthic);
                    } else {
                        interp.push(value);
                    }
                });
        addNativeWord("~>", "( array:list -- options:WordOptions )",
                "Converts [.key1 val1 .key2 val2] into word options",
                (inputs, options) -> new RuntimeValue.OptionsValue(
                        WordOptions.fromFlatArray(RuntimeValues.requireArray(inputs.get(0), "options").items())));
    }

    private void registerProfilingWords() {
        addDirectWord("PROFILE-START", "( -- )", "Starts profiling word execution",
                interp -> interp.profileLog().start());
        addDirectWord("PROFILE-END", "( -- )", "Stops profiling word execution",
                interp -> interp.profileLog().stop());
        addDirectWord("PROFILE-TIMESTAMP", "( label:str -- )", "Records profiling timestamp with label",
                interp -> interp.profileLog().addTimestamp(RuntimeValues.display(interp.pop(), " ")));
        addDirectWord("PROFILE-DATA", "( -- profile_data:record )", "Returns profiling data (word counts and timestamps)",
                interp -> interp.push(interp.profileLog().toRecord()));
    }

    private void registerOutputWords() {
        addDirectWord("INTERPOLATE", "( string:str [options:WordOptions] -- result:str )",
                "Interpolates variables (.name) into a string; \\. escapes a literal dot", interp -> {
                    WordOptions options = interp.popOptionsIfPresent();
                    RuntimeValue string = interp.pop();
                    String text = RuntimeValues.isNull(string) ? "" : RuntimeValues.requireString(string, "string");
                    interp.push(RuntimeValue.ofString(interpolate(interp, text, options)));
                });
        addDirectWord("PRINT", "( value:any [options:WordOptions] -- )",
                "Prints a value; strings interpolate variables (.name)", interp -> {
                    WordOptions options = interp.popOptionsIfPresent();
                    RuntimeValue value = interp.pop();
                    if (value.kind() == RuntimeValue.Kind.STRING) {
                        out.println(interpolate(interp, ((RuntimeValue.StringValue) value).value(), options));
                    } else {
                        out.println(format(value, options));
                    }
                });
    }

    private static Variable toVariable(Interpreter interp, RuntimeValue ref) {
        if (ref.kind() == RuntimeValue.Kind.VARIABLE) {
            return ((RuntimeValue.VariableRef) ref).variable();
        }
        if (ref.kind() == RuntimeValue.Kind.STRING) {
            return interp.declareVariable(((RuntimeValue.StringValue) ref).value());
        }
        throw new IllegalArgumentException("expected a variable or variable name, got " + ref.kind().label());
    }

    private static String interpolate(Interpreter interp, String text, WordOptions options) {
        String escaped = text.replace("\\.", ESCAPED_DOT);
        Matcher matcher = INTERPOLATED_VARIABLE.matcher(escaped);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            RuntimeValue value = interp.declareVariable(matcher.group(1)).value();
            matcher.appendReplacement(result, Matcher.quoteReplacement(format(value, options)));
        }
        matcher.appendTail(result);
        return result.toString().replace(ESCAPED_DOT, ".");
    }

    private static String format(RuntimeValue value, WordOptions options) {
        if (RuntimeValues.isNull(value)) {
            return options.getString("null_text", "null");
        }
        RuntimeValue json = options.get("json", RuntimeValue.ofBool(false));
        if (json.kind() == RuntimeValue.Kind.BOOL && ((RuntimeValue.BoolValue) json).value()) {
            return RuntimeValues.toJson(value);
        }
        return RuntimeValues.display(value, options.getString("separator", ", "));
    }
}
