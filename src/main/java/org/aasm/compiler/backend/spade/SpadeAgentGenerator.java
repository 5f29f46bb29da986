package org.aasm.compiler.backend.spade;

import org.aasm.compiler.backend.ICodeGenerator;
import org.aasm.compiler.backend.code.CodeWriter;
import org.aasm.compiler.ir.Action;
import org.aasm.compiler.ir.Agent;
import org.aasm.compiler.ir.AgentParameter;
import org.aasm.compiler.ir.Behaviour;
import org.aasm.compiler.ir.Message;
import org.aasm.compiler.ir.Program;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import static org.aasm.compiler.backend.spade.PythonArguments.quote;

/**
 * Emits one SPADE agent class per declared agent.
 * <p>
 * Every class has a constructor whose fields can be overridden through keyword arguments,
 * JSON message helpers, a {@code setup} method registering all behaviours with their
 * message templates, a periodic backup behaviour and one nested class per behaviour.
 * Behaviour kinds only differ in their SPADE base class and in how they are registered.
 */
public class SpadeAgentGenerator implements ICodeGenerator {

    private static final List<String> IMPORTS = List.of(
            "copy", "datetime", "random", "httpx", "numpy", "orjson", "spade");

    private final int indentSize;
    private final int receiveTimeout;

    /**
     * @param indentSize     Spaces per indentation level.
     * @param receiveTimeout Seconds a message-received behaviour waits for a message.
     */
    public SpadeAgentGenerator(int indentSize, int receiveTimeout) {
        this.indentSize = indentSize;
        this.receiveTimeout = receiveTimeout;
    }

    /**
     * Generates the agent unit. A program without agents yields no lines at all.
     */
    @Override
    public List<String> generate(Program program) {
        CodeWriter out = new CodeWriter(indentSize);
        if (program.agents().isEmpty()) {
            return out.lines();
        }
        IMPORTS.forEach(module -> out.line("import " + module));
        for (Agent agent : program.agents()) {
            out.newlines(2);
            new AgentEmitter(out, agent).emit();
        }
        return out.lines();
    }

    /**
     * Emits a single agent class.
     */
    private final class AgentEmitter {

        private final CodeWriter out;
        private final Agent agent;

        AgentEmitter(CodeWriter out, Agent agent) {
            this.out = out;
            this.agent = agent;
        }

        void emit() {
            out.block("class " + agent.name() + "(spade.agent.Agent):", () -> {
                constructor();
                out.newline();
                messageUtils();
                out.newline();
                setup();
                out.newline();
                backupBehaviour();
                out.newline();
                behaviours(agent.setupBehaviours().values(), "spade.behaviour.OneShotBehaviour");
                behaviours(agent.oneTimeBehaviours().values(), "spade.behaviour.TimeoutBehaviour");
                behaviours(agent.cyclicBehaviours().values(), "spade.behaviour.PeriodicBehaviour");
                behaviours(agent.messageReceivedBehaviours().values(), "spade.behaviour.CyclicBehaviour");
            });
        }

        private void constructor() {
            out.block("def __init__(self, jid, password, backup_url = None, backup_period = 60, backup_delay = 0, logger = None, **kwargs):", () -> {
                out.line("super().__init__(jid, password, verify_security=False)");
                out.line("if logger: logger.debug(f\"[{jid}] Received parameters: jid: {jid}, password: {password}, backup_url: {backup_url}, backup_period: {backup_period}, backup_delay: {backup_delay}, kwargs: {kwargs}\")");
                out.line("self.logger = logger");
                out.line("self.backup_url = backup_url");
                out.line("self.backup_period = backup_period");
                out.line("self.backup_delay = backup_delay");
                field("connections", "[]");
                field("msgRCount", "0");
                field("msgSCount", "0");
                for (AgentParameter.InitFloat p : agent.parametersOf(AgentParameter.InitFloat.class)) {
                    field(p.name(), p.value());
                }
                for (AgentParameter.NormalFloat p : agent.parametersOf(AgentParameter.NormalFloat.class)) {
                    field(p.name(), "numpy.random.normal(" + p.mean() + ", " + p.stdDev() + ")");
                }
                for (AgentParameter.ExpFloat p : agent.parametersOf(AgentParameter.ExpFloat.class)) {
                    field(p.name(), "numpy.random.exponential(1/" + p.lambda() + ")");
                }
                for (AgentParameter.EnumField p : agent.parametersOf(AgentParameter.EnumField.class)) {
                    String values = p.values().stream().map(v -> quote(v.value())).collect(Collectors.joining(", "));
                    String weights = p.values().stream().map(AgentParameter.EnumValue::weight).collect(Collectors.joining(", "));
                    field(p.name(), "random.choices([" + values + "], [" + weights + "])[0]");
                }
                for (AgentParameter.ConnectionList p : agent.parametersOf(AgentParameter.ConnectionList.class)) {
                    field(p.name(), "[]");
                }
                for (AgentParameter.MessageList p : agent.parametersOf(AgentParameter.MessageList.class)) {
                    field(p.name(), "[]");
                }
                out.line("if self.logger: self.logger.debug(f\"[{self.jid}] Class dict after initialization: {self.__dict__}\")");
            });
            out.newline();
            out.line("@property");
            out.block("def connCount(self):", () -> out.line("return len(self.connections)"));
        }

        private void field(String name, String initial) {
            out.line("self." + name + " = kwargs.get(" + quote(name) + ", " + initial + ")");
        }

        private void messageUtils() {
            out.block("def get_json_from_spade_message(self, msg):", () -> out.line("return orjson.loads(msg.body)"));
            out.newline();
            out.block("def get_spade_message(self, receiver_jid, body):", () -> {
                out.line("msg = spade.message.Message(to=receiver_jid)");
                out.line("body[\"sender\"] = str(self.jid)");
                out.line("msg.metadata[\"type\"] = body[\"type\"]");
                out.line("msg.metadata[\"performative\"] = body[\"performative\"]");
                out.line("msg.body = str(orjson.dumps(body), encoding=\"utf-8\")");
                out.line("return msg");
            });
        }

        private void setup() {
            out.block("def setup(self):", () -> {
                out.block("if self.backup_url:", () -> {
                    noMatchTemplate("BackupBehaviour");
                    out.line("self.add_behaviour(self.BackupBehaviour(start_at=datetime.datetime.now() + datetime.timedelta(seconds=self.backup_delay), period=self.backup_period), BackupBehaviour_template)");
                });
                for (Behaviour.Setup behaviour : agent.setupBehaviours().values()) {
                    noMatchTemplate(behaviour.name());
                    register(behaviour, "");
                }
                for (Behaviour.OneTime behaviour : agent.oneTimeBehaviours().values()) {
                    noMatchTemplate(behaviour.name());
                    register(behaviour, "start_at=datetime.datetime.now() + datetime.timedelta(seconds=" + behaviour.delay() + ")");
                }
                for (Behaviour.Cyclic behaviour : agent.cyclicBehaviours().values()) {
                    noMatchTemplate(behaviour.name());
                    register(behaviour, "period=" + behaviour.period());
                }
                for (Behaviour.MessageReceived behaviour : agent.messageReceivedBehaviours().values()) {
                    Message received = behaviour.receivedMessage();
                    out.line(behaviour.name() + "_template = spade.template.Template()");
                    out.line(behaviour.name() + "_template.set_metadata(\"type\", " + quote(received.type()) + ")");
                    out.line(behaviour.name() + "_template.set_metadata(\"performative\", " + quote(received.performative()) + ")");
                    register(behaviour, "");
                }
                out.line("if self.logger: self.logger.debug(f\"[{self.jid}] Class dict after setup: {self.__dict__}\")");
            });
        }

        private void noMatchTemplate(String behaviourName) {
            out.line(behaviourName + "_template = spade.template.Template()");
            out.line(behaviourName + "_template.set_metadata(\"reserved\", \"no_message_match\")");
        }

        private void register(Behaviour behaviour, String arguments) {
            out.line("self.add_behaviour(self." + behaviour.name() + "(" + arguments + "), " + behaviour.name() + "_template)");
        }

        private void backupBehaviour() {
            out.block("class BackupBehaviour(spade.behaviour.PeriodicBehaviour):", () -> {
                out.block("def __init__(self, start_at, period):", () -> {
                    out.line("super().__init__(start_at=start_at, period=period)");
                    out.line("self.http_client = httpx.AsyncClient(timeout=period)");
                });
                out.newline();
                out.block("async def run(self):", () -> {
                    out.block("data = {", () -> {
                        out.line("\"jid\": str(self.agent.jid),");
                        out.line("\"type\": " + quote(agent.name()) + ",");
                        out.block("\"floats\": {", () -> {
                            backupEntry("msgRCount");
                            backupEntry("msgSCount");
                            backupEntry("connCount");
                            agent.floatParamNames().forEach(this::backupEntry);
                        });
                        out.line("},");
                        out.block("\"enums\": {", () -> agent.parametersOf(AgentParameter.EnumField.class)
                                .forEach(p -> backupEntry(p.name())));
                        out.line("},");
                        out.block("\"connections\": {", () -> {
                            backupEntry("connections");
                            agent.parametersOf(AgentParameter.ConnectionList.class).forEach(p -> backupEntry(p.name()));
                        });
                        out.line("},");
                        out.block("\"messages\": {", () -> agent.parametersOf(AgentParameter.MessageList.class)
                                .forEach(p -> backupEntry(p.name())));
                        out.line("}");
                    });
                    out.line("}");
                    out.line("if self.agent.logger: self.agent.logger.debug(f\"[{self.agent.jid}] Sending backup data: {data}\")");
                    out.block("try:", () -> out.line("await self.http_client.post(self.agent.backup_url, headers={\"Content-Type\": \"application/json\"}, data=orjson.dumps(data))"));
                    out.block("except Exception as e:", () -> out.line("if self.agent.logger: self.agent.logger.error(f\"[{self.agent.jid}] Backup error type: {e.__class__}, additional info: {e}\")"));
                });
            });
        }

        private void backupEntry(String name) {
            out.line(quote(name) + ": self.agent." + name + ",");
        }

        private void behaviours(Collection<? extends Behaviour> behaviours, String baseClass) {
            for (Behaviour behaviour : behaviours) {
                behaviour(behaviour, baseClass);
                out.newline();
            }
        }

        private void behaviour(Behaviour behaviour, String baseClass) {
            out.block("class " + behaviour.name() + "(" + baseClass + "):", () -> {
                for (Action action : behaviour.actions().values()) {
                    action(behaviour, action);
                }
                out.block("async def run(self):", () -> {
                    if (behaviour.receivesMessage()) {
                        receive();
                        out.indented(() -> behaviour.actions().values().forEach(action -> call(behaviour, action)));
                    } else if (behaviour.actions().isEmpty()) {
                        out.line("...");
                    } else {
                        behaviour.actions().values().forEach(action -> call(behaviour, action));
                    }
                });
            });
        }

        private void receive() {
            out.line("rcv = await self.receive(timeout=" + receiveTimeout + ")");
            out.block("if rcv:", () -> {
                out.line("rcv = self.agent.get_json_from_spade_message(rcv)");
                out.line("self.agent.msgRCount += 1");
                out.line("if self.agent.logger: self.agent.logger.debug(f\"[{self.agent.jid}] Received message: {rcv}\")");
            });
        }

        private void call(Behaviour behaviour, Action action) {
            String prefix = action instanceof Action.SendMessage ? "await " : "";
            out.line(prefix + "self." + action.name() + (behaviour.receivesMessage() ? "(rcv)" : "()"));
        }

        private void action(Behaviour behaviour, Action action) {
            String prefix = action instanceof Action.SendMessage ? "async " : "";
            String parameters = behaviour.receivesMessage() ? "(self, rcv):" : "(self):";
            out.block(prefix + "def " + action.name() + parameters, () -> {
                out.line("if self.agent.logger: self.agent.logger.debug(f\"[{self.agent.jid}] Run action " + action.name() + "\")");
                if (action instanceof Action.SendMessage send) {
                    sendMessage(send.sendMessage());
                }
                new SpadeInstructionTranslator(out).translate(action.body());
            });
            out.newline();
        }

        private void sendMessage(Message message) {
            StringBuilder line = new StringBuilder("send = { \"type\": ").append(quote(message.type()))
                    .append(", \"performative\": ").append(quote(message.performative())).append(", ");
            for (String field : message.floatParams()) {
                line.append(quote(field)).append(": 0.0, ");
            }
            out.line(line.append("}").toString());
        }
    }
}
