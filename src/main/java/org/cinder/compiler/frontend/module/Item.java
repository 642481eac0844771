package org.cinder.compiler.frontend.module;

import java.util.List;

/**
 * An entry in the namespace of a single file.
 */
public sealed interface Item permits Item.Import, Item.Function, Item.Type, Item.GlobalVariable {

    /**
     * An imported file.
     * @param fileIndex The module index of the imported file.
     */
    record Import(int fileIndex) implements Item {}

    /**
     * An overload set.
     * @param definitions Indices into {@link ModuleTable#functions()}, in definition order.
     */
    record Function(List<Integer> definitions) implements Item {
        public Function {
            definitions = List.copyOf(definitions);
        }
    }

    /**
     * A type declaration. Reserved until the language has type declarations.
     * @param index The index of the declaration.
     */
    record Type(int index) implements Item {}

    /**
     * A variable declared at the top level of the file.
     * @param slot The global slot of the variable within its file.
     */
    record GlobalVariable(int slot) implements Item {}
}
