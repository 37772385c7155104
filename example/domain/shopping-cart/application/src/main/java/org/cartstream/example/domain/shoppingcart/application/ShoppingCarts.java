/*
 * Copyright 2024 The CartStream Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.cartstream.example.domain.shoppingcart.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.cartstream.application.converter.CloudEventConverter;
import org.cartstream.application.converter.jackson.JacksonCloudEventConverter;
import org.cartstream.application.service.blocking.ApplicationService;
import org.cartstream.application.service.blocking.generic.GenericApplicationService;
import org.cartstream.eventstore.api.WriteResult;
import org.cartstream.eventstore.api.blocking.EventStore;
import org.cartstream.eventstore.api.blocking.EventStoreOperations;
import org.cartstream.eventstore.api.blocking.EventStoreQueries;
import org.cartstream.eventstore.api.blocking.EventStreamExists;
import org.cartstream.eventstore.jsonfile.JsonFileEventStore;
import org.cartstream.eventstore.jsonfile.JsonFileEventStoreConfig;
import org.cartstream.example.domain.shoppingcart.model.CustomerShoppingSummary;
import org.cartstream.example.domain.shoppingcart.model.PricedProductItem;
import org.cartstream.example.domain.shoppingcart.model.ProductItem;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartCommand;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartCommand.AddProductItemToShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartCommand.CancelShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartCommand.ConfirmShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartCommand.OpenShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartCommand.RemoveProductItemFromShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartDecider;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartSummary;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;

/**
 * The entry point for a transport (such as an HTTP API) to shopping carts.
 * <p>
 * Every command is validated, decided on the current events of the shopping cart and written to the event store conditioned on the
 * expected version. Pass {@code null} as expected version to condition the write on the version that was read while handling the command.
 * Failures are signalled with exceptions that {@link ErrorCategory#of(Throwable)} can categorize.
 * </p>
 */
public class ShoppingCarts {
    private static final Logger log = LoggerFactory.getLogger(ShoppingCarts.class);

    public static final URI CLOUD_EVENT_SOURCE = URI.create("urn:cartstream:shopping-cart");

    private final EventStreamExists eventStreamExists;
    private final EventStoreQueries eventStoreQueries;
    private final EventStoreOperations eventStoreOperations;
    private final ApplicationService<ShoppingCartCommand, ShoppingCartEvent> applicationService;
    private final ShoppingCartProjections projections;
    private final ProductPriceLookup productPriceLookup;
    private final Supplier<String> idGenerator;

    public <ES extends EventStore & EventStoreQueries & EventStoreOperations> ShoppingCarts(ES eventStore, ProductPriceLookup productPriceLookup, Clock clock) {
        this(eventStore, productPriceLookup, clock, () -> UUID.randomUUID().toString());
    }

    /**
     * @param idGenerator Generates the ids of new shopping carts, and of customers when a cart is opened without a customer id
     */
    public <ES extends EventStore & EventStoreQueries & EventStoreOperations> ShoppingCarts(ES eventStore, ProductPriceLookup productPriceLookup, Clock clock,
                                                                                           Supplier<String> idGenerator) {
        requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
        requireNonNull(productPriceLookup, ProductPriceLookup.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        requireNonNull(idGenerator, "Id generator cannot be null");
        CloudEventConverter<ShoppingCartEvent> cloudEventConverter = cloudEventConverter(objectMapper());
        this.eventStreamExists = eventStore;
        this.eventStoreQueries = eventStore;
        this.eventStoreOperations = eventStore;
        this.applicationService = new GenericApplicationService<>(eventStore, cloudEventConverter, new ShoppingCartDecider(clock));
        this.projections = new ShoppingCartProjections(eventStore, cloudEventConverter);
        this.productPriceLookup = productPriceLookup;
        this.idGenerator = idGenerator;
        projections.rebuild();
    }

    /**
     * Create shopping carts stored as JSON files, recovering the carts already present in the configured data directory.
     */
    public static ShoppingCarts storedInJsonFiles(JsonFileEventStoreConfig config, ProductPriceLookup productPriceLookup, Clock clock) {
        return new ShoppingCarts(new JsonFileEventStore(config), productPriceLookup, clock);
    }

    /**
     * @param customerId The customer that owns the cart. A new customer id is generated if {@code null} or blank.
     */
    public OpenedShoppingCart openShoppingCart(@Nullable String customerId) {
        String customerIdToUse = customerId == null || customerId.isBlank() ? idGenerator.get() : customerId;
        String shoppingCartId = idGenerator.get();
        WriteResult writeResult = execute(shoppingCartId, new OpenShoppingCart(shoppingCartId, customerIdToUse), null);
        log.debug("Opened shopping cart {} for customer {}", shoppingCartId, customerIdToUse);
        return new OpenedShoppingCart(shoppingCartId, customerIdToUse, writeResult.getStreamVersion());
    }

    /**
     * Add a product to a cart at its current catalog price.
     *
     * @throws UnknownProductException If the product has no price in the catalog
     */
    public CommandResult addProductItem(String shoppingCartId, String productId, String productName, int quantity, @Nullable Long expectedVersion) {
        requireShoppingCartId(shoppingCartId);
        requireProductItem(productId, quantity);
        if (productName == null || productName.isBlank()) {
            throw new ValidationException("Product name cannot be blank");
        }
        BigDecimal unitPrice = productPriceLookup.priceOf(productId).orElseThrow(() -> new UnknownProductException(productId));
        PricedProductItem productItem = new PricedProductItem(productId, productName, quantity, unitPrice);
        return commandResult(shoppingCartId, execute(shoppingCartId, new AddProductItemToShoppingCart(shoppingCartId, productItem), expectedVersion));
    }

    public CommandResult removeProductItem(String shoppingCartId, String productId, int quantity, @Nullable Long expectedVersion) {
        requireShoppingCartId(shoppingCartId);
        requireProductItem(productId, quantity);
        ProductItem productItem = new ProductItem(productId, quantity);
        return commandResult(shoppingCartId, execute(shoppingCartId, new RemoveProductItemFromShoppingCart(shoppingCartId, productItem), expectedVersion));
    }

    public CommandResult confirm(String shoppingCartId, @Nullable Long expectedVersion) {
        requireShoppingCartId(shoppingCartId);
        return commandResult(shoppingCartId, execute(shoppingCartId, new ConfirmShoppingCart(shoppingCartId), expectedVersion));
    }

    public CommandResult cancel(String shoppingCartId, @Nullable Long expectedVersion) {
        requireShoppingCartId(shoppingCartId);
        return commandResult(shoppingCartId, execute(shoppingCartId, new CancelShoppingCart(shoppingCartId), expectedVersion));
    }

    /**
     * @throws ShoppingCartNotFoundException If the cart has no events
     */
    public ShoppingCartDetails shoppingCart(String shoppingCartId) {
        requireShoppingCartId(shoppingCartId);
        return projections.shoppingCart(shoppingCartId).orElseThrow(() -> new ShoppingCartNotFoundException(shoppingCartId));
    }

    public List<ShoppingCartSummary> allShoppingCarts() {
        return projections.allShoppingCarts();
    }

    public Optional<CustomerShoppingSummary> customerSummary(String customerId) {
        if (customerId == null || customerId.isBlank()) {
            throw new ValidationException("Customer id cannot be blank");
        }
        return projections.customerShoppingSummary(customerId);
    }

    /**
     * Permanently delete a shopping cart and all its events. This is an administrative operation, a cart that is no longer wanted
     * by the customer is cancelled instead.
     *
     * @throws ShoppingCartNotFoundException If the cart has no events
     */
    public void deleteShoppingCart(String shoppingCartId) {
        requireShoppingCartId(shoppingCartId);
        if (!eventStreamExists.exists(shoppingCartId)) {
            throw new ShoppingCartNotFoundException(shoppingCartId);
        }
        eventStoreOperations.deleteEventStream(shoppingCartId);
        projections.invalidate();
        log.info("Deleted shopping cart {}", shoppingCartId);
    }

    /**
     * Permanently delete all shopping carts. This is an administrative operation.
     *
     * @return The number of deleted carts
     */
    public int deleteAllShoppingCarts() {
        List<String> shoppingCartIds = eventStoreQueries.streamIds().toList();
        shoppingCartIds.forEach(eventStoreOperations::deleteEventStream);
        projections.invalidate();
        log.info("Deleted {} shopping cart(s)", shoppingCartIds.size());
        return shoppingCartIds.size();
    }

    private WriteResult execute(String shoppingCartId, ShoppingCartCommand command, @Nullable Long expectedVersion) {
        if (expectedVersion != null && expectedVersion < 0) {
            throw new ValidationException("Expected version cannot be negative");
        }
        return applicationService.execute(shoppingCartId, command, expectedVersion, projections::shoppingCartChanged);
    }

    private static CommandResult commandResult(String shoppingCartId, WriteResult writeResult) {
        return new CommandResult(shoppingCartId, writeResult.getStreamVersion());
    }

    private static void requireShoppingCartId(String shoppingCartId) {
        if (shoppingCartId == null || shoppingCartId.isBlank()) {
            throw new ValidationException("Shopping cart id cannot be blank");
        }
    }

    private static void requireProductItem(String productId, int quantity) {
        if (productId == null || productId.isBlank()) {
            throw new ValidationException("Product id cannot be blank");
        }
        if (quantity <= 0) {
            throw new ValidationException("Quantity must be positive, was " + quantity);
        }
    }

    /**
     * @return The object mapper used to serialize shopping cart events
     */
    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @return A converter that stores shopping cart events as cloud events with the cart id as subject and the time of the event as time
     */
    public static CloudEventConverter<ShoppingCartEvent> cloudEventConverter(ObjectMapper objectMapper) {
        return new JacksonCloudEventConverter.Builder<>(objectMapper, CLOUD_EVENT_SOURCE, ShoppingCartEvent.class)
                .timeMapper(event -> event.timestamp().atOffset(UTC))
                .subjectMapper(ShoppingCartEvent::shoppingCartId)
                .build();
    }
}
