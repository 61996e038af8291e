package io.github.goodees.behavior;

/*-
 * #%L
 * ese-behavior
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

/**
 * Derivation of type tags for commands and events.
 */
public class EventType {
    private EventType() {

    }

    /**
     * Default implementation of type name. Strips Immutable prefix, and suffix Event.
     * @param simpleClassname the name of the event class
     * @return Simple name. ImmutableThingHappenedEvent becomes ThingHappened.
     */
    public static String defaultTypeName(String simpleClassname) {
        return fromSimpleClassnameStripping(fromSimpleClassnameStripping(simpleClassname, "Immutable", ""), "",
            "Event");
    }

    public static String defaultTypeName(Class<?> clazz) {
        return defaultTypeName(clazz.getSimpleName());
    }

    /**
     * Type name of a command. Strips Immutable prefix, and suffix Command.
     * @param clazz the command class
     * @return Simple name. ImmutableAddParticipantCommand becomes AddParticipant.
     */
    public static String defaultCommandName(Class<?> clazz) {
        return fromSimpleClassnameStripping(fromSimpleClassnameStripping(clazz.getSimpleName(), "Immutable", ""), "",
            "Command");
    }

    public static String fromSimpleClassnameStripping(String simpleClassName, String prefix, String suffix) {
        int start = simpleClassName.startsWith(prefix) ? prefix.length() : 0;
        int end = simpleClassName.endsWith(suffix) ? simpleClassName.length() - suffix.length() : simpleClassName.length();
        if (end <= start) {
            return simpleClassName;
        }
        return simpleClassName.substring(start, end);
    }
}
