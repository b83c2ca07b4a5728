package org.hdldoc.parser.builder;

import org.hdldoc.parser.api.PortDirection;
import org.hdldoc.parser.api.VerilogModule;
import org.hdldoc.parser.api.VerilogSubModule;
import org.hdldoc.parser.diagnostics.DiagnosticsEngine;
import org.hdldoc.parser.lexer.LexerMatch;
import org.hdldoc.parser.verilog.VerilogAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link VerilogModule} records from the action stream of the Verilog lexer in a
 * single pass.
 * <p>
 * The builder only interprets action names and their captured groups. It tracks the
 * module under construction, the active port direction and composite types, the item
 * that receives trailing comments, module description lines that are not attached yet,
 * and the submodule being instantiated. Actions that make no sense in the current state
 * raise an {@link EntityBuildException}; nothing is dropped silently.
 * <p>
 * A builder is used for exactly one stream and is not thread-safe.
 */
public class EntityBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(EntityBuilder.class);

    private final DiagnosticsEngine diagnostics;
    private final List<VerilogModule> modules = new ArrayList<>();
    private final DescriptionBuffer pendingDescription = new DescriptionBuffer();

    private ModuleBuildContext module;
    private PortDirection direction = PortDirection.INPUT;
    private String portType = CompositeType.DEFAULT_TYPE;
    private String parameterType = CompositeType.DEFAULT_TYPE;
    private Describable lastItem;
    private int position;
    private boolean used = false;

    /**
     * Creates a new builder.
     * @param diagnostics The engine of the parsed source, receives warnings about tolerated input.
     */
    public EntityBuilder(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Consumes the whole stream.
     * @param matches The actions emitted by the Verilog lexer.
     * @return The modules that were closed, in source order.
     * @throws EntityBuildException if an action cannot be applied.
     * @throws IllegalStateException if the builder was used before.
     */
    public List<VerilogModule> build(Iterable<LexerMatch<VerilogAction>> matches) {
        if (used) {
            throw new IllegalStateException("An entity builder can only be used for one stream");
        }
        used = true;
        for (LexerMatch<VerilogAction> match : matches) {
            accept(match);
        }
        return List.copyOf(modules);
    }

    /**
     * @return {@code true} while a module has been opened but not closed.
     */
    public boolean isModuleOpen() {
        return module != null;
    }

    /**
     * @return The name of the open module, or {@code null}.
     */
    public String openModuleName() {
        return module == null ? null : module.name();
    }

    void accept(LexerMatch<VerilogAction> match) {
        position = match.position();
        switch (match.action()) {
            case MODULE_OPEN -> openModule(match.group(0));
            case MODULE_CLOSE -> closeModule();
            case PARAMETER_GROUP_OPEN -> {
                requireModule(match.action());
                parameterType = CompositeType.assemble(match.group(0), match.group(1), match.group(2));
            }
            case PARAMETER_ITEM_WITH_DEFAULT -> addParameter(match.group(0), match.group(1).strip());
            case PARAMETER_ITEM_BARE -> addBareParameter(match.group(0));
            case PORT_GROUP_OPEN -> {
                requireModule(match.action());
                direction = PortDirection.fromKeyword(match.group(0));
                portType = CompositeType.assemble(match.group(1), match.group(2), match.group(3));
            }
            case PORT_ITEM -> {
                requireModule(match.action());
                lastItem = module.declarePort(match.group(0), direction, portType);
            }
            case SECTION_MARKER -> {
                requireModule(match.action());
                module.markSection(match.group(0).strip(), position);
            }
            case SUBMODULE_WITH_PARAMS_OPEN -> beginSubModule(match.action(), match.group(0), null);
            case SUBMODULE_PLAIN_OPEN -> beginSubModule(match.action(), match.group(0), match.group(1));
            case SUBMODULE_PARAMS_CLOSE_PORTS_OPEN -> nameSubModule(match.group(0));
            case SUBMODULE_NEXT_INSTANCE -> nextInstance(match.group(0));
            case SUBMODULE_CLOSE -> closeSubModule();
            case CONNECTION_OPEN -> {
                SubModuleDraft submodule = requireSubModule(match.action());
                if (submodule.hasOpenConnection()) {
                    throw fail("Connection ." + match.group(0) + " opened inside connection ." + submodule.openConnection());
                }
                submodule.openConnection(match.group(0));
            }
            case CONNECTION_TEXT -> requireConnection(match.action()).appendConnectionText(match.group(0));
            case CONNECTION_CLOSE -> requireConnection(match.action()).closeConnection();
            case METACOMMENT -> attachMetacomment(match.group(0));
            case TRAILING_COMMENT -> {
                if (lastItem != null) {
                    lastItem.appendDescription(match.group(0));
                }
            }
        }
    }

    private void openModule(String name) {
        if (module != null) {
            throw fail("Module " + name + " opened while module " + module.name() + " is still open");
        }
        module = new ModuleBuildContext(name);
        direction = PortDirection.INPUT;
        portType = CompositeType.DEFAULT_TYPE;
        parameterType = CompositeType.DEFAULT_TYPE;
        lastItem = null;
    }

    private void closeModule() {
        requireModule(VerilogAction.MODULE_CLOSE);
        SubModuleDraft open = module.currentSubModule();
        if (open != null) {
            throw fail("Module " + module.name() + " closed while instance of " + open.moduleType() + " is still open");
        }
        VerilogModule finished = module.finish(pendingDescription.text(), dropped ->
                diagnostics.warning("Section '" + dropped.label() + "' labels no ports and was dropped",
                        dropped.offset()));
        modules.add(finished);
        LOG.debug("Module {} finished: {} port(s), {} parameter(s), {} submodule(s)", finished.name(),
                finished.ports().size(), finished.parameters().size(), finished.submodules().size());
        module = null;
        lastItem = null;
        pendingDescription.clear();
    }

    private void addParameter(String name, String defaultValue) {
        requireModule(VerilogAction.PARAMETER_ITEM_WITH_DEFAULT);
        lastItem = module.addParameter(name, parameterType, defaultValue);
    }

    private void addBareParameter(String name) {
        requireModule(VerilogAction.PARAMETER_ITEM_BARE);
        if (module.hasParameter(name)) {
            LOG.debug("Ignoring duplicate parameter {} in module {}", name, module.name());
            diagnostics.warning("Duplicate parameter '" + name + "' in module " + module.name() + " ignored",
                    position);
            return;
        }
        lastItem = module.addParameter(name, parameterType, null);
    }

    private void beginSubModule(VerilogAction action, String moduleType, String instanceName) {
        requireModule(action);
        SubModuleDraft open = module.currentSubModule();
        if (open != null) {
            throw fail("Instance of " + moduleType + " started while instance of " + open.moduleType() + " is still open");
        }
        module.beginSubModule(moduleType, instanceName);
    }

    private void nameSubModule(String instanceName) {
        SubModuleDraft submodule = requireSubModule(VerilogAction.SUBMODULE_PARAMS_CLOSE_PORTS_OPEN);
        if (submodule.instanceName() != null) {
            throw fail("Instance " + submodule.instanceName() + " of " + submodule.moduleType()
                    + " renamed to " + instanceName);
        }
        submodule.setInstanceName(instanceName);
    }

    private void nextInstance(String instanceName) {
        requireClosable(VerilogAction.SUBMODULE_NEXT_INSTANCE);
        VerilogSubModule closed = module.continueSubModule(instanceName);
        LOG.trace("Submodule {} added to module {}, next instance {}", closed, module.name(), instanceName);
    }

    private void closeSubModule() {
        requireClosable(VerilogAction.SUBMODULE_CLOSE);
        VerilogSubModule closed = module.closeSubModule();
        LOG.trace("Submodule {} added to module {}", closed, module.name());
    }

    private void requireClosable(VerilogAction action) {
        SubModuleDraft submodule = requireSubModule(action);
        if (submodule.instanceName() == null) {
            throw fail("Instance of " + submodule.moduleType() + " closed without an instance name");
        }
        if (submodule.hasOpenConnection()) {
            throw fail("Instance " + submodule.instanceName() + " closed inside connection ." + submodule.openConnection());
        }
    }

    private void attachMetacomment(String text) {
        if (module != null && module.currentSubModule() != null) {
            module.currentSubModule().appendDescription(text);
        } else if (lastItem != null) {
            lastItem.appendDescription(text);
        } else {
            pendingDescription.appendDescription(text);
        }
    }

    private void requireModule(VerilogAction action) {
        if (module == null) {
            throw fail(action + " outside of a module");
        }
    }

    private SubModuleDraft requireSubModule(VerilogAction action) {
        requireModule(action);
        SubModuleDraft submodule = module.currentSubModule();
        if (submodule == null) {
            throw fail(action + " without an instantiation in progress in module " + module.name());
        }
        return submodule;
    }

    private SubModuleDraft requireConnection(VerilogAction action) {
        SubModuleDraft submodule = requireSubModule(action);
        if (!submodule.hasOpenConnection()) {
            throw fail(action + " without an open connection in instance of " + submodule.moduleType());
        }
        return submodule;
    }

    private EntityBuildException fail(String message) {
        diagnostics.error(message, position);
        return new EntityBuildException(message, position);
    }
}
